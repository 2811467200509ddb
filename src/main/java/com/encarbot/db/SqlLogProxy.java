package com.encarbot.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;

/**
 * Wraps a JDBC connection so every statement execution is logged with its elapsed time
 * on the "SQL" logger.
 */
final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch"
    );
    private static final int MAX_SQL_CHARS = 600;

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        return proxy(Connection.class, (proxy, method, args) -> {
            Object out = invoke(delegate, method, args);
            if (out instanceof PreparedStatement ps
                    && "prepareStatement".equals(method.getName())
                    && args != null && args.length > 0 && args[0] instanceof String sql) {
                return proxy(PreparedStatement.class, new ExecutionLogger(ps, sql, logger));
            }
            if (out instanceof Statement st && "createStatement".equals(method.getName())) {
                return proxy(Statement.class, new ExecutionLogger(st, null, logger));
            }
            return out;
        });
    }

    @SuppressWarnings("unchecked")
    private static <T> T proxy(Class<T> type, InvocationHandler handler) {
        return (T) Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, handler);
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private static final class ExecutionLogger implements InvocationHandler {
        private final Statement delegate;
        private final String preparedSql;
        private final Logger logger;

        private ExecutionLogger(Statement delegate, String preparedSql, Logger logger) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if (!EXECUTE_METHODS.contains(name)) {
                return SqlLogProxy.invoke(delegate, method, args);
            }
            String sql = preparedSql;
            if (sql == null && args != null && args.length > 0 && args[0] instanceof String text) {
                sql = text;
            }
            long started = System.nanoTime();
            try {
                Object out = SqlLogProxy.invoke(delegate, method, args);
                if (logger.isInfoEnabled()) {
                    logger.info("SQL ok method={} elapsed_ms={}{} sql={}",
                            name, elapsed(started), resultSummary(out), normalize(sql));
                }
                return out;
            } catch (Throwable e) {
                logger.warn("SQL fail method={} elapsed_ms={} err={} sql={}",
                        name, elapsed(started), e.getMessage(), normalize(sql));
                throw e;
            }
        }

        private static String elapsed(long startedNanos) {
            return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
        }

        private static String resultSummary(Object result) {
            if (result instanceof Integer || result instanceof Long) {
                return " rows=" + result;
            }
            if (result instanceof int[] batch) {
                return " batch_size=" + batch.length;
            }
            return "";
        }

        private static String normalize(String sql) {
            if (sql == null) {
                return "";
            }
            String oneLine = sql.replaceAll("\\s+", " ").trim();
            return oneLine.length() <= MAX_SQL_CHARS ? oneLine : oneLine.substring(0, MAX_SQL_CHARS) + "...";
        }
    }
}
