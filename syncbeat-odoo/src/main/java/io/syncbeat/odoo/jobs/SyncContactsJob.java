package io.syncbeat.odoo.jobs;

import io.syncbeat.mirror.MirrorStore;
import io.syncbeat.mirror.ReconciliationEngine;
import io.syncbeat.mirror.RemoteQuery;
import io.syncbeat.mirror.RemoteSource;
import io.syncbeat.odoo.OdooQueries;
import io.syncbeat.odoo.model.Contact;
import io.syncbeat.odoo.model.ContactFieldMapper;

public class SyncContactsJob extends MirrorSyncJob<Contact> {

    public static final String NAME = "sync_contacts";

    public SyncContactsJob(RemoteSource source, ReconciliationEngine engine, MirrorStore<Contact> store) {
        super(source, engine, store, new ContactFieldMapper());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String kind() {
        return "contacts";
    }

    @Override
    protected RemoteQuery query() {
        return OdooQueries.CONTACTS;
    }
}
