package io.syncbeat.odoo.jdbc;

import io.syncbeat.mirror.jdbc.JdbcMirrorStore;
import io.syncbeat.odoo.model.Contact;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Mirror table {@code contacts}.
 */
public class JdbcContactStore extends JdbcMirrorStore<Contact> {

    public static final String TABLE = "contacts";

    public JdbcContactStore(NamedParameterJdbcTemplate jdbc) {
        super(jdbc, TABLE, List.of("name", "email", "phone", "write_date"));
    }

    @Override
    protected Contact mapRow(ResultSet rs) throws SQLException {
        Contact c = new Contact();
        c.setName(rs.getString("name"));
        c.setEmail(rs.getString("email"));
        c.setPhone(rs.getString("phone"));
        c.setWriteDate(toInstant(rs.getTimestamp("write_date")));
        return c;
    }

    @Override
    protected void bindColumns(Contact record, MapSqlParameterSource params) {
        params.addValue("name", record.getName())
                .addValue("email", record.getEmail())
                .addValue("phone", record.getPhone())
                .addValue("write_date", toTimestamp(record.getWriteDate()));
    }
}
