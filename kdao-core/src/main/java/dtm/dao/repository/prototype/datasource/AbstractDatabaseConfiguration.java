package dtm.dao.repository.prototype.datasource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Base das configurações fluentes. Valores não informados caem nos
 * padrões de {@link DatabaseConfiguration}.
 */
@SuppressWarnings("unchecked")
public abstract class AbstractDatabaseConfiguration<C extends AbstractDatabaseConfiguration<C>> implements DatabaseConfiguration {

    private final String driverClassName;
    private final String url;
    private final String username;
    private final String password;
    private final List<Class<?>> entityClasses = new ArrayList<>();

    private Boolean showSql;
    private Boolean formatSql;
    private String hbm2ddlAuto;
    private Integer maximumPoolSize;
    private Integer minimumIdle;
    private Long connectionTimeout;
    private Long idleTimeout;
    private Boolean registerShutdownHook;

    protected AbstractDatabaseConfiguration(String driverClassName, String url, String username, String password) {
        this.driverClassName = driverClassName;
        this.url = url;
        this.username = username;
        this.password = password;
    }

    public C withEntities(Class<?>... entities) {
        this.entityClasses.addAll(Arrays.asList(entities));
        return (C) this;
    }

    public C withShowSql(boolean showSql) {
        this.showSql = showSql;
        return (C) this;
    }

    public C withFormatSql(boolean formatSql) {
        this.formatSql = formatSql;
        return (C) this;
    }

    public C withHbm2ddlAuto(String hbm2ddlAuto) {
        this.hbm2ddlAuto = hbm2ddlAuto;
        return (C) this;
    }

    public C withMaximumPoolSize(int maximumPoolSize) {
        this.maximumPoolSize = maximumPoolSize;
        return (C) this;
    }

    public C withMinimumIdle(int minimumIdle) {
        this.minimumIdle = minimumIdle;
        return (C) this;
    }

    public C withConnectionTimeout(long connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return (C) this;
    }

    public C withIdleTimeout(long idleTimeout) {
        this.idleTimeout = idleTimeout;
        return (C) this;
    }

    public C withShutdownHook(boolean registerShutdownHook) {
        this.registerShutdownHook = registerShutdownHook;
        return (C) this;
    }

    @Override
    public String getDriverClassName() { return driverClassName; }

    @Override
    public String getUrl() { return url; }

    @Override
    public String getUsername() { return username; }

    @Override
    public String getPassword() { return password; }

    @Override
    public List<Class<?>> getEntityClasses() {
        return Collections.unmodifiableList(entityClasses);
    }

    @Override
    public boolean showSql() {
        return showSql != null ? showSql : DatabaseConfiguration.super.showSql();
    }

    @Override
    public boolean formatSql() {
        return formatSql != null ? formatSql : DatabaseConfiguration.super.formatSql();
    }

    @Override
    public String getHbm2ddlAuto() {
        return hbm2ddlAuto != null ? hbm2ddlAuto : DatabaseConfiguration.super.getHbm2ddlAuto();
    }

    @Override
    public int getMaximumPoolSize() {
        return maximumPoolSize != null ? maximumPoolSize : DatabaseConfiguration.super.getMaximumPoolSize();
    }

    @Override
    public int getMinimumIdle() {
        return minimumIdle != null ? minimumIdle : DatabaseConfiguration.super.getMinimumIdle();
    }

    @Override
    public long getConnectionTimeout() {
        return connectionTimeout != null ? connectionTimeout : DatabaseConfiguration.super.getConnectionTimeout();
    }

    @Override
    public long getIdleTimeout() {
        return idleTimeout != null ? idleTimeout : DatabaseConfiguration.super.getIdleTimeout();
    }

    @Override
    public boolean registerShutdownHook() {
        return registerShutdownHook != null ? registerShutdownHook : DatabaseConfiguration.super.registerShutdownHook();
    }
}
