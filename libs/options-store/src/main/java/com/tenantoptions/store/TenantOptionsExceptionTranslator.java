package com.tenantoptions.store;

import java.sql.SQLException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.support.AbstractFallbackSQLExceptionTranslator;
import org.springframework.jdbc.support.SQLExceptionSubclassTranslator;

/**
 * Maps constraint and trigger failures of every supported vendor to
 * {@link DataIntegrityViolationException}; anything else falls through to Spring's default
 * translation.
 * <ul>
 *   <li>SQLSTATE class {@code 23}: integrity constraint violation (PostgreSQL, MySQL, Oracle)
 *   <li>SQLite result code 19 ({@code SQLITE_CONSTRAINT}), including extended codes and
 *       {@code RAISE(FAIL, ...)} from triggers
 *   <li>SQLSTATE {@code 45000}: MySQL {@code SIGNAL} from the consistency trigger
 *   <li>Oracle error 20001: {@code RAISE_APPLICATION_ERROR} from the consistency trigger
 * </ul>
 */
public class TenantOptionsExceptionTranslator extends AbstractFallbackSQLExceptionTranslator {

    static final int SQLITE_CONSTRAINT = 19;
    static final int ORACLE_TRIGGER_ERROR = 20001;

    public TenantOptionsExceptionTranslator() {
        setFallbackTranslator(new SQLExceptionSubclassTranslator());
    }

    @Override
    protected DataAccessException doTranslate(String task, String sql, SQLException ex) {
        if (isIntegrityViolation(ex)) {
            return new DataIntegrityViolationException(buildMessage(task, sql, ex), ex);
        }
        return null;
    }

    static boolean isIntegrityViolation(SQLException ex) {
        String state = ex.getSQLState();
        if (state != null && (state.startsWith("23") || state.equals("45000"))) {
            return true;
        }
        int code = ex.getErrorCode();
        if (code == ORACLE_TRIGGER_ERROR) {
            return true;
        }
        return isSqlite(ex) && (code & 0xff) == SQLITE_CONSTRAINT;
    }

    private static boolean isSqlite(SQLException ex) {
        return ex.getClass().getName().startsWith("org.sqlite.");
    }
}
