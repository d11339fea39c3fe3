package io.syncbeat.odoo.model;

import io.syncbeat.mirror.FieldMapper;
import io.syncbeat.mirror.Reference;

import java.util.Map;

import static io.syncbeat.mirror.RemoteValues.number;
import static io.syncbeat.mirror.RemoteValues.reference;
import static io.syncbeat.mirror.RemoteValues.text;
import static io.syncbeat.mirror.RemoteValues.textOr;
import static io.syncbeat.mirror.RemoteValues.timestamp;

public class InvoiceFieldMapper implements FieldMapper<Invoice> {

    @Override
    public Invoice create() {
        return new Invoice();
    }

    @Override
    public void apply(Map<String, Object> remote, Invoice target) {
        target.setName(textOr(remote.get("name"), ""));
        target.setMoveType(textOr(remote.get("move_type"), Invoice.CUSTOMER_INVOICE));
        target.setInvoiceDate(timestamp(remote.get("invoice_date")));

        Reference partner = reference(remote.get("partner_id"));
        target.setPartnerId(partner.id());
        target.setPartnerName(partner.label());

        target.setAmountTotal(number(remote.get("amount_total")));
        target.setAmountResidual(number(remote.get("amount_residual")));
        target.setState(text(remote.get("state")));

        Reference currency = reference(remote.get("currency_id"));
        target.setCurrencyId(currency.id());
        target.setCurrencyName(currency.label());

        target.setWriteDate(timestamp(remote.get("write_date")));
        target.setCreateDate(timestamp(remote.get("create_date")));
    }
}
