package czm.staff_application_be.notification;

import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Data-access component for the {@code message_ref} table.
 */
@Repository
public class MessageRefDao {

    private static final RowMapper<MessageRef> ROW_MAPPER = (rs, rn) -> new MessageRef(
            rs.getString("conversation_id"),
            rs.getString("message_handle"),
            MessageRole.valueOf(rs.getString("role")),
            rs.getString("application_id"));

    private final JdbcTemplate jdbc;

    public MessageRefDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(MessageRef ref, OffsetDateTime createdAt) {
        jdbc.update("""
                INSERT INTO message_ref (conversation_id, message_handle, application_id, role, created_at)
                VALUES (?, ?, ?, ?, ?)
                """, ref.conversationId(), ref.messageHandle(), ref.applicationId(), ref.role().name(), createdAt);
    }

    public int delete(MessageRef ref) {
        return jdbc.update("DELETE FROM message_ref WHERE conversation_id = ? AND message_handle = ?",
                ref.conversationId(), ref.messageHandle());
    }

    public List<MessageRef> findByConversation(String conversationId, Collection<MessageRole> roles) {
        if (roles.isEmpty()) {
            return List.of();
        }
        String inClause = roles.stream().map(role -> "?").reduce((a, b) -> a + "," + b).orElse("?");
        List<Object> params = new ArrayList<>();
        params.add(conversationId);
        roles.forEach(role -> params.add(role.name()));
        return jdbc.query("""
                SELECT conversation_id, message_handle, application_id, role
                FROM message_ref
                WHERE conversation_id = ? AND role IN (""" + inClause + ") ORDER BY created_at, message_handle",
                ROW_MAPPER, params.toArray());
    }

    public Optional<MessageRef> findByApplicationAndRole(String applicationId, MessageRole role) {
        List<MessageRef> rows = jdbc.query("""
                SELECT conversation_id, message_handle, application_id, role
                FROM message_ref
                WHERE application_id = ? AND role = ?
                ORDER BY created_at DESC
                LIMIT 1
                """, ROW_MAPPER, applicationId, role.name());
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }
}
