package io.syncbeat.odoo;

import io.syncbeat.mirror.RemoteQuery;

import java.util.List;

/**
 * The remote reads the mirror jobs issue.
 */
public final class OdooQueries {

    public static final RemoteQuery CONTACTS = new RemoteQuery(
            "res.partner",
            List.of(),
            List.of("id", "name", "email", "phone", "write_date"),
            null);

    public static final RemoteQuery CUSTOMER_INVOICES = new RemoteQuery(
            "account.move",
            List.of(List.of("move_type", "=", "out_invoice")),
            List.of("id", "name", "move_type", "invoice_date", "partner_id", "amount_total",
                    "amount_residual", "state", "currency_id", "write_date", "create_date"),
            "write_date desc");

    private OdooQueries() {
    }
}
