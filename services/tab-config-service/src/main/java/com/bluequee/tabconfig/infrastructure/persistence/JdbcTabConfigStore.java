package com.bluequee.tabconfig.infrastructure.persistence;

import com.bluequee.tabconfig.domain.TabFilter;
import com.bluequee.tabconfig.domain.TabFilter.ScopeSelector;
import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.TabScope;
import com.bluequee.tabconfig.domain.error.DuplicateTabKeyException;
import com.bluequee.tabconfig.domain.error.TabNotFoundException;
import com.bluequee.tabconfig.domain.port.TabConfigStore;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link TabConfigStore} over the {@code tab_configs} table.
 *
 * <p>WHY plain JDBC: every query is a short filtered read or a single-row write, and the per-key
 * lock is a {@code SELECT ... FOR UPDATE} that an ORM would hide. Data access failures surface as
 * Spring {@link org.springframework.dao.DataAccessException}s.
 */
public class JdbcTabConfigStore implements TabConfigStore {

    private static final String SELECT = "SELECT " + TabRecordRowMapper.COLUMNS + " FROM tab_configs";
    private static final String ORDER_BY = " ORDER BY display_order, tab_key, scope";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final SettingsCodec settingsCodec;
    private final TabRecordRowMapper rowMapper;
    private final Clock clock;

    public JdbcTabConfigStore(
            NamedParameterJdbcTemplate jdbc,
            TransactionTemplate transactions,
            SettingsCodec settingsCodec,
            Clock clock) {
        this.jdbc = jdbc;
        this.transactions = transactions;
        this.settingsCodec = settingsCodec;
        this.rowMapper = new TabRecordRowMapper(settingsCodec);
        this.clock = clock;
    }

    @Override
    public List<TabRecord> find(TabFilter filter) {
        var params = new MapSqlParameterSource();
        List<String> clauses = new ArrayList<>();
        int i = 0;
        for (ScopeSelector selector : filter.anyOf()) {
            if (selector.scope() == TabScope.SYSTEM) {
                clauses.add("(scope = 'system' AND is_system_default = TRUE)");
            } else {
                clauses.add("(scope = :scope" + i + " AND scope_owner_id = :owner" + i + ")");
                params.addValue("scope" + i, selector.scope().value());
                params.addValue("owner" + i, selector.ownerId());
            }
            i++;
        }
        StringBuilder sql = new StringBuilder(SELECT).append(" WHERE (");
        sql.append(String.join(" OR ", clauses)).append(')');
        if (filter.key() != null) {
            sql.append(" AND tab_key = :key");
            params.addValue("key", filter.key());
        }
        sql.append(ORDER_BY);
        return jdbc.query(sql.toString(), params, rowMapper);
    }

    @Override
    public Optional<TabRecord> findById(long id) {
        return jdbc.query(SELECT + " WHERE id = :id", new MapSqlParameterSource("id", id), rowMapper)
                .stream()
                .findFirst();
    }

    @Override
    public List<TabRecord> findAllById(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbc.query(
                SELECT + " WHERE id IN (:ids)" + ORDER_BY,
                new MapSqlParameterSource("ids", ids),
                rowMapper);
    }

    @Override
    public Optional<TabRecord> findInSlot(String key, TabScope scope, Long ownerId) {
        var params =
                new MapSqlParameterSource("key", key)
                        .addValue("scope", scope.value())
                        .addValue("owner", ownerId);
        String ownerClause = ownerId == null ? "scope_owner_id IS NULL" : "scope_owner_id = :owner";
        return jdbc.query(
                        SELECT + " WHERE tab_key = :key AND scope = :scope AND " + ownerClause,
                        params,
                        rowMapper)
                .stream()
                .findFirst();
    }

    @Override
    public TabRecord insert(TabRecord record) {
        Instant now = clock.instant();
        var params =
                writeParams(record, now)
                        .addValue("key", record.key())
                        .addValue("contentType", record.contentType())
                        .addValue("category", record.category(), Types.VARCHAR)
                        .addValue("scope", record.scope().value())
                        .addValue("owner", record.scopeOwnerId(), Types.BIGINT)
                        .addValue("organizationId", record.organizationId(), Types.BIGINT)
                        .addValue("systemDefault", record.systemDefault())
                        .addValue("createdBy", record.createdBy(), Types.BIGINT)
                        .addValue("createdAt", Timestamp.from(now));
        KeyHolder keys = new GeneratedKeyHolder();
        try {
            jdbc.update(
                    "INSERT INTO tab_configs (tab_key, label, icon, content_type, category, settings,"
                            + " scope, scope_owner_id, organization_id, is_visible, is_mandatory,"
                            + " is_system_default, display_order, created_by, created_at, updated_at)"
                            + " VALUES (:key, :label, :icon, :contentType, :category, :settings,"
                            + " :scope, :owner, :organizationId, :visible, :mandatory,"
                            + " :systemDefault, :displayOrder, :createdBy, :createdAt, :updatedAt)",
                    params,
                    keys,
                    new String[] {"id"});
        } catch (DuplicateKeyException e) {
            throw new DuplicateTabKeyException(record.key(), record.scope(), record.scopeOwnerId(), e);
        }
        Number id = keys.getKey();
        if (id == null) {
            throw new IllegalStateException("No generated id returned for tab '" + record.key() + "'");
        }
        return record.stored(id.longValue(), now, now);
    }

    @Override
    public TabRecord update(TabRecord record) {
        if (record.id() == null) {
            throw new IllegalArgumentException("Cannot update an unsaved tab record");
        }
        Instant now = clock.instant();
        var params = writeParams(record, now).addValue("id", record.id());
        int rows =
                jdbc.update(
                        "UPDATE tab_configs SET label = :label, icon = :icon, settings = :settings,"
                                + " is_visible = :visible, is_mandatory = :mandatory,"
                                + " display_order = :displayOrder, updated_at = :updatedAt"
                                + " WHERE id = :id",
                        params);
        if (rows == 0) {
            throw new TabNotFoundException(record.id());
        }
        return record.stored(record.id(), record.createdAt(), now);
    }

    @Override
    public boolean delete(long id) {
        return jdbc.update("DELETE FROM tab_configs WHERE id = :id", new MapSqlParameterSource("id", id))
                > 0;
    }

    @Override
    public int deleteOverrides(TabScope scope, long ownerId) {
        return jdbc.update(
                "DELETE FROM tab_configs WHERE scope = :scope AND scope_owner_id = :owner"
                        + " AND is_system_default = FALSE",
                new MapSqlParameterSource("scope", scope.value()).addValue("owner", ownerId));
    }

    @Override
    public <T> T inKeyTransaction(String key, Supplier<T> work) {
        return transactions.execute(
                status -> {
                    jdbc.queryForList(
                            "SELECT id FROM tab_configs WHERE tab_key = :key FOR UPDATE",
                            new MapSqlParameterSource("key", key),
                            Long.class);
                    return work.get();
                });
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactions.execute(status -> work.get());
    }

    private MapSqlParameterSource writeParams(TabRecord record, Instant now) {
        return new MapSqlParameterSource("label", record.label())
                .addValue("icon", record.icon(), Types.VARCHAR)
                .addValue("settings", settingsCodec.encode(record.settings()))
                .addValue("visible", record.visible())
                .addValue("mandatory", record.mandatory())
                .addValue("displayOrder", record.displayOrder())
                .addValue("updatedAt", Timestamp.from(now));
    }
}
