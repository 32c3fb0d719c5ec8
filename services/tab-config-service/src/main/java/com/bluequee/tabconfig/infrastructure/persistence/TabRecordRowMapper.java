package com.bluequee.tabconfig.infrastructure.persistence;

import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.TabScope;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import org.springframework.jdbc.core.RowMapper;

/** Maps one {@code tab_configs} row. */
class TabRecordRowMapper implements RowMapper<TabRecord> {

    static final String COLUMNS =
            "id, tab_key, label, icon, content_type, category, settings, scope, scope_owner_id,"
                    + " organization_id, is_visible, is_mandatory, is_system_default, display_order,"
                    + " created_by, created_at, updated_at";

    private final SettingsCodec settingsCodec;

    TabRecordRowMapper(SettingsCodec settingsCodec) {
        this.settingsCodec = settingsCodec;
    }

    @Override
    public TabRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new TabRecord(
                rs.getLong("id"),
                rs.getString("tab_key"),
                rs.getString("label"),
                rs.getString("icon"),
                rs.getString("content_type"),
                rs.getString("category"),
                settingsCodec.decode(rs.getString("settings")),
                TabScope.parse(rs.getString("scope")),
                rs.getObject("scope_owner_id", Long.class),
                rs.getObject("organization_id", Long.class),
                rs.getBoolean("is_visible"),
                rs.getBoolean("is_mandatory"),
                rs.getBoolean("is_system_default"),
                rs.getInt("display_order"),
                rs.getObject("created_by", Long.class),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
