package io.syncbeat.odoo.jdbc;

import io.syncbeat.mirror.jdbc.JdbcMirrorStore;
import io.syncbeat.odoo.model.Invoice;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Mirror table {@code invoices}.
 */
public class JdbcInvoiceStore extends JdbcMirrorStore<Invoice> {

    public static final String TABLE = "invoices";

    public JdbcInvoiceStore(NamedParameterJdbcTemplate jdbc) {
        super(jdbc, TABLE, List.of(
                "name", "move_type", "invoice_date",
                "partner_id", "partner_name",
                "amount_total", "amount_residual", "state",
                "currency_id", "currency_name",
                "write_date", "create_date"));
    }

    @Override
    protected Invoice mapRow(ResultSet rs) throws SQLException {
        Invoice i = new Invoice();
        i.setName(rs.getString("name"));
        i.setMoveType(rs.getString("move_type"));
        i.setInvoiceDate(toInstant(rs.getTimestamp("invoice_date")));
        i.setPartnerId(nullableLong(rs, "partner_id"));
        i.setPartnerName(rs.getString("partner_name"));
        i.setAmountTotal(nullableDouble(rs, "amount_total"));
        i.setAmountResidual(nullableDouble(rs, "amount_residual"));
        i.setState(rs.getString("state"));
        i.setCurrencyId(nullableLong(rs, "currency_id"));
        i.setCurrencyName(rs.getString("currency_name"));
        i.setWriteDate(toInstant(rs.getTimestamp("write_date")));
        i.setCreateDate(toInstant(rs.getTimestamp("create_date")));
        return i;
    }

    @Override
    protected void bindColumns(Invoice record, MapSqlParameterSource params) {
        params.addValue("name", record.getName())
                .addValue("move_type", record.getMoveType())
                .addValue("invoice_date", toTimestamp(record.getInvoiceDate()))
                .addValue("partner_id", record.getPartnerId())
                .addValue("partner_name", record.getPartnerName())
                .addValue("amount_total", record.getAmountTotal())
                .addValue("amount_residual", record.getAmountResidual())
                .addValue("state", record.getState())
                .addValue("currency_id", record.getCurrencyId())
                .addValue("currency_name", record.getCurrencyName())
                .addValue("write_date", toTimestamp(record.getWriteDate()))
                .addValue("create_date", toTimestamp(record.getCreateDate()));
    }
}
