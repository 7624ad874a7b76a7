package com.baykanat.metrics.core.infrastructure.directory;

import com.baykanat.metrics.core.config.AppProperties;
import com.baykanat.metrics.core.domain.exception.ServiceUnavailableException;
import com.baykanat.metrics.core.domain.model.ComparisonOp;
import com.baykanat.metrics.core.domain.model.DirectoryUser;
import com.baykanat.metrics.core.domain.model.MembersPage;
import com.baykanat.metrics.core.domain.model.rule.EntityAttributeRule;
import com.baykanat.metrics.core.infrastructure.sql.PointFilterSql;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Kullanıcı dizinini paylaşılan JdbcTemplate üzerinden okur (tablo: app.directory.users-table).
 * Retry + Circuit Breaker; tükenince 503 + Retry-After.
 */
@Slf4j
@Component
public class JdbcUserDirectory implements UserDirectory {

    private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");
    private static final int RETRY_AFTER_SECONDS = 30;

    private static final RowMapper<DirectoryUser> USER_ROW_MAPPER = (rs, rowNum) -> DirectoryUser.builder()
            .email(rs.getString("email"))
            .role(rs.getString("role"))
            .emailVerified(rs.getBoolean("email_verified"))
            .locked(rs.getBoolean("locked"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final String usersTable;

    public JdbcUserDirectory(JdbcTemplate jdbcTemplate, AppProperties appProperties) {
        this.jdbcTemplate = jdbcTemplate;
        String table = appProperties.getDirectory().getUsersTable();
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalStateException("Invalid app.directory.users-table: " + table);
        }
        this.usersTable = table;
    }

    @Override
    @Retry(name = "userDirectory", fallbackMethod = "findByEmailsFallback")
    @CircuitBreaker(name = "userDirectory")
    public List<DirectoryUser> findByEmails(Collection<String> emails) {
        if (emails.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT lower(email) AS email, role, email_verified, locked FROM " + usersTable
                + " WHERE lower(email) IN (" + PointFilterSql.placeholders(emails) + ")";
        return jdbcTemplate.query(sql, USER_ROW_MAPPER, emails.toArray());
    }

    @Override
    @Retry(name = "userDirectory", fallbackMethod = "pageEmailsFallback")
    @CircuitBreaker(name = "userDirectory")
    public MembersPage pageEmails(EntityAttributeRule condition, int limit, long offset) {
        List<Object> params = new ArrayList<>();
        String where = "";
        if (condition != null) {
            // Kolon adı enum'dan gelir; NULL role != kuralına uyar (bellek içi eşleşme ile aynı)
            String operator = condition.getOp() == ComparisonOp.EQ ? " = ?" : " IS DISTINCT FROM ?";
            where = " WHERE " + condition.getAttribute().column() + operator;
            params.add(condition.expectedValue());
        }

        Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + usersTable + where, Long.class,
                params.toArray());

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(limit);
        pageParams.add(offset);
        List<String> items = jdbcTemplate.queryForList(
                "SELECT lower(email) FROM " + usersTable + where + " ORDER BY lower(email) ASC LIMIT ? OFFSET ?",
                String.class, pageParams.toArray());
        return new MembersPage(items, total != null ? total : 0L);
    }

    @SuppressWarnings("unused")
    private List<DirectoryUser> findByEmailsFallback(Collection<String> emails, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for user directory. Rejecting lookup of {} users", emails.size());
        throw new ServiceUnavailableException(
                "User directory is temporarily unavailable. Circuit breaker is open.", RETRY_AFTER_SECONDS, ex);
    }

    @SuppressWarnings("unused")
    private List<DirectoryUser> findByEmailsFallback(Collection<String> emails, Exception ex) {
        log.error("User directory lookup failed after all retries for {} users: {}", emails.size(), ex.getMessage());
        throw new ServiceUnavailableException(
                "User directory is temporarily unavailable.", RETRY_AFTER_SECONDS, ex);
    }

    @SuppressWarnings("unused")
    private MembersPage pageEmailsFallback(EntityAttributeRule condition, int limit, long offset,
                                           CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for user directory. Rejecting member page (offset={})", offset);
        throw new ServiceUnavailableException(
                "User directory is temporarily unavailable. Circuit breaker is open.", RETRY_AFTER_SECONDS, ex);
    }

    @SuppressWarnings("unused")
    private MembersPage pageEmailsFallback(EntityAttributeRule condition, int limit, long offset, Exception ex) {
        log.error("User directory paging failed after all retries (offset={}): {}", offset, ex.getMessage());
        throw new ServiceUnavailableException(
                "User directory is temporarily unavailable.", RETRY_AFTER_SECONDS, ex);
    }
}
