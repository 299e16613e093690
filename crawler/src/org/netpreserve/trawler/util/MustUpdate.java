package org.netpreserve.trawler.util;

import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.core.statement.StatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizerFactory;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizingAnnotation;

import java.lang.annotation.*;
import java.lang.reflect.Method;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Fails the statement if it didn't touch the expected number of rows. Used on updates whose target row
 * must exist, so a missing frontier entry surfaces instead of silently doing nothing.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD})
@SqlStatementCustomizingAnnotation(value = MustUpdate.Handler.class)
public @interface MustUpdate {
    /**
     * Number of rows that should be updated. (-1 means any except 0)
     */
    int value() default -1;

    class Handler implements SqlStatementCustomizerFactory {
        @Override
        public SqlStatementCustomizer createForMethod(Annotation annotation, Class<?> sqlObjectType, Method method) {
            int expected = ((MustUpdate) annotation).value();
            String name = method.getDeclaringClass().getSimpleName() + "." + method.getName() + "()";
            return stmt -> stmt.addCustomizer(new StatementCustomizer() {
                @Override
                public void afterExecution(PreparedStatement stmt, StatementContext ctx) throws SQLException {
                    long updateCount = stmt.getUpdateCount();
                    if (expected == -1 && updateCount == 0) {
                        throw new Exception(name + " didn't update any rows");
                    } else if (expected != -1 && expected != updateCount) {
                        throw new Exception(name + " expected to update " + expected + " rows but updated " + updateCount);
                    }
                }
            });
        }
    }

    class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }
    }
}
