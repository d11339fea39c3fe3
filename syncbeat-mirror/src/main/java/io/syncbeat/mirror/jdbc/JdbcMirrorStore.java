package io.syncbeat.mirror.jdbc;

import io.syncbeat.mirror.MirrorStore;
import io.syncbeat.mirror.MirroredRecord;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link MirrorStore} over one relational table with the columns
 * {@code id, remote_id, <domain columns>, created_at, updated_at}.
 *
 * <p>Subclasses name the domain columns and bind them; parameter names equal column names.
 */
public abstract class JdbcMirrorStore<E extends MirroredRecord> implements MirrorStore<E> {

    static final int DELETE_CHUNK_SIZE = 500;

    private final NamedParameterJdbcTemplate jdbc;
    private final RowMapper<E> rowMapper;
    private final String selectSql;
    private final String pageSql;
    private final String byIdSql;
    private final String insertSql;
    private final String updateSql;
    private final String deleteSql;

    protected JdbcMirrorStore(NamedParameterJdbcTemplate jdbc, String table, List<String> columns) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(columns, "columns must not be null");

        this.selectSql = "SELECT id, remote_id, " + String.join(", ", columns)
                + ", created_at, updated_at FROM " + table;
        this.pageSql = selectSql + " ORDER BY id LIMIT :limit OFFSET :offset";
        this.byIdSql = selectSql + " WHERE id = :id";
        this.insertSql = "INSERT INTO " + table + " (remote_id, " + String.join(", ", columns)
                + ", created_at, updated_at) VALUES (:remote_id, "
                + columns.stream().map(c -> ":" + c).collect(Collectors.joining(", "))
                + ", :created_at, :updated_at)";
        this.updateSql = "UPDATE " + table + " SET "
                + columns.stream().map(c -> c + " = :" + c).collect(Collectors.joining(", "))
                + ", updated_at = :updated_at WHERE remote_id = :remote_id";
        this.deleteSql = "DELETE FROM " + table + " WHERE remote_id IN (:remote_ids)";
        this.rowMapper = (rs, rowNum) -> {
            E record = mapRow(rs);
            record.setId(rs.getLong("id"));
            record.setRemoteId(rs.getLong("remote_id"));
            record.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
            record.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
            return record;
        };
    }

    /**
     * Maps the domain columns of the current row onto a fresh entity.
     */
    protected abstract E mapRow(ResultSet rs) throws SQLException;

    /**
     * Binds the domain columns of {@code record}.
     */
    protected abstract void bindColumns(E record, MapSqlParameterSource params);

    @Override
    public List<E> findAll() {
        return jdbc.query(selectSql, rowMapper);
    }

    @Override
    public List<E> findPage(int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("offset", offset)
                .addValue("limit", Math.min(limit, MAX_PAGE_SIZE));
        return jdbc.query(pageSql, params, rowMapper);
    }

    @Override
    public Optional<E> findById(long id) {
        List<E> rows = jdbc.query(byIdSql, new MapSqlParameterSource("id", id), rowMapper);
        return rows.stream().findFirst();
    }

    @Override
    public void insertAll(List<E> records) {
        if (records.isEmpty()) {
            return;
        }
        jdbc.batchUpdate(insertSql, toBatch(records));
    }

    @Override
    public void updateAll(List<E> records) {
        if (records.isEmpty()) {
            return;
        }
        jdbc.batchUpdate(updateSql, toBatch(records));
    }

    @Override
    public int deleteByRemoteIds(Collection<Long> remoteIds) {
        List<Long> ids = new ArrayList<>(remoteIds);
        int deleted = 0;
        for (int from = 0; from < ids.size(); from += DELETE_CHUNK_SIZE) {
            List<Long> chunk = ids.subList(from, Math.min(from + DELETE_CHUNK_SIZE, ids.size()));
            deleted += jdbc.update(deleteSql, new MapSqlParameterSource("remote_ids", chunk));
        }
        return deleted;
    }

    private SqlParameterSource[] toBatch(List<E> records) {
        SqlParameterSource[] batch = new SqlParameterSource[records.size()];
        for (int i = 0; i < records.size(); i++) {
            E record = records.get(i);
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("remote_id", record.getRemoteId())
                    .addValue("created_at", toTimestamp(record.getCreatedAt()))
                    .addValue("updated_at", toTimestamp(record.getUpdatedAt()));
            bindColumns(record, params);
            batch[i] = params;
        }
        return batch;
    }

    protected static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    protected static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    /**
     * Reads a nullable BIGINT column.
     */
    protected static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Reads a nullable DOUBLE PRECISION column.
     */
    protected static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
