package io.syncbeat.odoo.jobs;

import io.syncbeat.core.JobInvocation;
import io.syncbeat.core.JobResult;
import io.syncbeat.mirror.ReconciliationEngine;
import io.syncbeat.odoo.MirrorDatabase;
import io.syncbeat.odoo.OdooQueries;
import io.syncbeat.odoo.jdbc.JdbcContactStore;
import io.syncbeat.odoo.jdbc.JdbcInvoiceStore;
import io.syncbeat.odoo.model.Contact;
import io.syncbeat.odoo.model.Invoice;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class MirrorSyncJobTest {

    private static final Instant NOW = Instant.parse("2026-04-01T06:00:00Z");

    private MirrorDatabase db;
    private FakeRemoteSource source;
    private ReconciliationEngine engine;

    @BeforeEach
    void setUp() {
        db = new MirrorDatabase();
        source = new FakeRemoteSource();
        engine = new ReconciliationEngine(db.transactions(), false, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private static JobInvocation invocation(String task) {
        return new JobInvocation(task, task, null, null, null, NOW);
    }

    private static List<Map<String, Object>> partners(int... ids) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (int id : ids) {
            Map<String, Object> r = new HashMap<>();
            r.put("id", id);
            r.put("name", "Partner " + id);
            r.put("email", false);
            r.put("phone", false);
            r.put("write_date", "2026-03-01 08:15:00");
            records.add(r);
        }
        return records;
    }

    @Test
    void syncContactsShouldMirrorAndReportCounts() {
        JdbcContactStore store = new JdbcContactStore(db.jdbc());
        SyncContactsJob job = new SyncContactsJob(source, engine, store);
        source.recordsByModel.put("res.partner", partners(1, 2, 3));
        job.execute(invocation(SyncContactsJob.NAME));

        source.recordsByModel.put("res.partner", partners(2, 3, 4));
        JobResult result = job.execute(invocation(SyncContactsJob.NAME));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.message()).isEqualTo("Synced 3 contacts from Odoo");
        assertThat(result.details()).containsEntry("inserted", 1).containsEntry("updated", 2)
                .containsEntry("deleted", 1).containsEntry("total", 3);
        assertThat(store.findAll()).extracting(Contact::getRemoteId).containsExactlyInAnyOrder(2L, 3L, 4L);
    }

    @Test
    void largeContactSetShouldBeReadInPages() {
        JdbcContactStore store = new JdbcContactStore(db.jdbc());
        source.recordsByModel.put("res.partner", partners(IntStream.rangeClosed(1, 150).toArray()));

        JobResult result = new SyncContactsJob(source, engine, store).execute(invocation(SyncContactsJob.NAME));

        assertThat(result.details()).containsEntry("inserted", 150);
        assertThat(source.queries).hasSize(2);
    }

    @Test
    void oversizedFieldValueShouldStillBeMirrored() {
        JdbcContactStore store = new JdbcContactStore(db.jdbc());
        List<Map<String, Object>> records = partners(IntStream.rangeClosed(1, 50).toArray());
        String longPhone = "+1 555 0100 ext. " + "9".repeat(300);
        records.get(24).put("phone", longPhone);
        records.get(25).put("name", "Partner " + "x".repeat(1000));
        source.recordsByModel.put("res.partner", records);

        JobResult result = new SyncContactsJob(source, engine, store).execute(invocation(SyncContactsJob.NAME));

        assertThat(result.isSuccess()).isTrue();
        assertThat(store.findAll()).hasSize(50);
        assertThat(store.findAll()).extracting(Contact::getPhone).contains(longPhone);
    }

    @Test
    void failedReconciliationShouldReportAShortMessage() {
        JdbcContactStore store = new JdbcContactStore(db.jdbc());
        db.jdbc().getJdbcTemplate().execute("DROP TABLE contacts");
        source.recordsByModel.put("res.partner", partners(1));

        JobResult result = new SyncContactsJob(source, engine, store).execute(invocation(SyncContactsJob.NAME));

        assertThat(result.status()).isEqualTo(JobResult.Status.ERROR);
        assertThat(result.message()).isEqualTo("Error syncing contacts: reconciliation failed");
    }

    @Test
    void syncInvoicesShouldUseTheCustomerInvoiceQuery() {
        JdbcInvoiceStore store = new JdbcInvoiceStore(db.jdbc());
        Map<String, Object> inv = new HashMap<>();
        inv.put("id", 501);
        inv.put("name", "INV/2026/0001");
        inv.put("move_type", "out_invoice");
        inv.put("partner_id", List.of(7, "Acme"));
        inv.put("amount_total", 1250.0);
        inv.put("currency_id", false);
        source.recordsByModel.put("account.move", List.of(inv));

        JobResult result = new SyncInvoicesJob(source, engine, store).execute(invocation(SyncInvoicesJob.NAME));

        assertThat(result.message()).isEqualTo("Synced 1 invoices from Odoo");
        assertThat(source.queries).containsOnly(OdooQueries.CUSTOMER_INVOICES);
        Invoice stored = store.findAll().get(0);
        assertThat(stored.getPartnerId()).isEqualTo(7L);
        assertThat(stored.getPartnerName()).isEqualTo("Acme");
        assertThat(stored.getCurrencyId()).isNull();
        assertThat(stored.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void emptyRemoteShouldKeepLocalRows() {
        JdbcContactStore store = new JdbcContactStore(db.jdbc());
        SyncContactsJob job = new SyncContactsJob(source, engine, store);
        source.recordsByModel.put("res.partner", partners(1, 2));
        job.execute(invocation(SyncContactsJob.NAME));

        source.recordsByModel.put("res.partner", List.of());
        JobResult result = job.execute(invocation(SyncContactsJob.NAME));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.message()).isEqualTo("No contacts found in Odoo");
        assertThat(store.findAll()).hasSize(2);
    }

    @Test
    void unreachableRemoteShouldFailWithoutTouchingTheTable() {
        JdbcContactStore store = new JdbcContactStore(db.jdbc());
        SyncContactsJob job = new SyncContactsJob(source, engine, store);
        source.recordsByModel.put("res.partner", partners(1, 2));
        job.execute(invocation(SyncContactsJob.NAME));

        source.down = true;
        JobResult result = job.execute(invocation(SyncContactsJob.NAME));

        assertThat(result.status()).isEqualTo(JobResult.Status.ERROR);
        assertThat(result.message()).isEqualTo("Error syncing contacts: remote fetch failed");
        assertThat(store.findAll().stream().map(Contact::getRemoteId).collect(Collectors.toList()))
                .containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    void heartbeatShouldAlwaysSucceed() {
        JobResult result = new HeartbeatJob().execute(invocation(HeartbeatJob.NAME));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.details()).containsEntry("firedAt", NOW.toString());
    }
}
