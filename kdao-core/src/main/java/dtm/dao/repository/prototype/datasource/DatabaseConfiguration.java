package dtm.dao.repository.prototype.datasource;

import java.util.List;

public interface DatabaseConfiguration {

    String getDriverClassName();
    String getUrl();
    String getUsername();
    String getPassword();

    String getDialect();

    List<Class<?>> getEntityClasses();

    default String getHbm2ddlAuto() {
        return "update";
    }

    default boolean showSql() {
        return true;
    }

    default boolean formatSql() {
        return false;
    }

    default int getMaximumPoolSize() {
        return 20;
    }

    default int getMinimumIdle() {
        return 5;
    }

    default long getConnectionTimeout() {
        return 20000;
    }

    default long getIdleTimeout() {
        return 300000;
    }

    default boolean registerShutdownHook() {
        return false;
    }
}
