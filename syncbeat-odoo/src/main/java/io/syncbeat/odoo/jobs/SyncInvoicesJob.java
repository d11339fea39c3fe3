package io.syncbeat.odoo.jobs;

import io.syncbeat.mirror.MirrorStore;
import io.syncbeat.mirror.ReconciliationEngine;
import io.syncbeat.mirror.RemoteQuery;
import io.syncbeat.mirror.RemoteSource;
import io.syncbeat.odoo.OdooQueries;
import io.syncbeat.odoo.model.Invoice;
import io.syncbeat.odoo.model.InvoiceFieldMapper;

/**
 * Mirrors customer invoices only.
 */
public class SyncInvoicesJob extends MirrorSyncJob<Invoice> {

    public static final String NAME = "sync_invoices";

    public SyncInvoicesJob(RemoteSource source, ReconciliationEngine engine, MirrorStore<Invoice> store) {
        super(source, engine, store, new InvoiceFieldMapper());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String kind() {
        return "invoices";
    }

    @Override
    protected RemoteQuery query() {
        return OdooQueries.CUSTOMER_INVOICES;
    }
}
