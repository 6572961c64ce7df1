package dtm.dao.repository.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dtm.dao.repository.exceptions.DatabaseInitializationException;
import dtm.dao.repository.prototype.datasource.DatabaseConfiguration;
import dtm.dao.repository.prototype.datasource.SessionFactoryContext;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.HibernateException;
import org.hibernate.SessionFactory;
import org.hibernate.boot.registry.StandardServiceRegistry;
import org.hibernate.boot.registry.StandardServiceRegistryBuilder;
import org.hibernate.boot.registry.classloading.spi.ClassLoadingException;
import org.hibernate.cfg.AvailableSettings;
import org.hibernate.cfg.Configuration;
import org.hibernate.service.spi.ServiceException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Monta o pool HikariCP e a {@link SessionFactory} do Hibernate a partir de uma
 * {@link DatabaseConfiguration}.
 */
@Slf4j
public class HibernateConfiguration {

    public SessionFactoryContext createSessionFactoryContext(DatabaseConfiguration databaseConfiguration) {
        validDatabaseConfiguration(databaseConfiguration);

        HikariDataSource dataSource = null;
        StandardServiceRegistry serviceRegistry = null;
        try {
            dataSource = new HikariDataSource(getHikariConfig(databaseConfiguration));

            Configuration configuration = new Configuration();
            configuration.setProperty(AvailableSettings.DIALECT, databaseConfiguration.getDialect());
            configuration.setProperty(AvailableSettings.HBM2DDL_AUTO, databaseConfiguration.getHbm2ddlAuto());
            configuration.setProperty(AvailableSettings.SHOW_SQL, String.valueOf(databaseConfiguration.showSql()));
            configuration.setProperty(AvailableSettings.FORMAT_SQL, String.valueOf(databaseConfiguration.formatSql()));
            configuration.setProperty(AvailableSettings.CONNECTION_PROVIDER_DISABLES_AUTOCOMMIT, "true");

            if (databaseConfiguration.getEntityClasses().isEmpty()) {
                log.warn("Nenhuma entidade foi registrada na configuração do banco. Consultas falharão por falta de mapeamento.");
            }
            for (Class<?> entityClass : databaseConfiguration.getEntityClasses()) {
                log.debug("Registrando entidade: {}", entityClass.getName());
                configuration.addAnnotatedClass(entityClass);
            }

            serviceRegistry = new StandardServiceRegistryBuilder()
                    .applySettings(configuration.getProperties())
                    .applySetting(AvailableSettings.DATASOURCE, dataSource)
                    .build();

            SessionFactory sessionFactory = configuration.buildSessionFactory(serviceRegistry);
            SessionFactoryContext context = createContext(databaseConfiguration, sessionFactory, dataSource);

            if (databaseConfiguration.registerShutdownHook()) {
                registerGracefulShutdown(context);
            }
            return context;
        } catch (ServiceException e) {
            releaseQuietly(serviceRegistry, dataSource);
            Throwable rootCause = e.getCause();
            if (rootCause instanceof ClassNotFoundException || String.valueOf(e.getMessage()).contains("Unable to load class")) {
                log.error("""

                [ ERRO DE DEPENDÊNCIA ]
                O Hibernate tentou configurar o banco, mas não encontrou o Driver JDBC.
                > Driver ausente : {}
                > Solução       : Adicione o driver JDBC correspondente ao classpath do projeto.
                """, databaseConfiguration.getDriverClassName());

                throw new DatabaseInitializationException(String.format(
                        "Erro de Dependência: Driver JDBC '%s' não encontrado no classpath.",
                        databaseConfiguration.getDriverClassName()
                ), e);
            }

            log.error("""

            [ ERRO DE CONEXÃO ]
            O Driver foi encontrado, mas a comunicação com o banco falhou.
            > URL tentada    : {}
            > Detalhe técnico: {}
            """, databaseConfiguration.getUrl(), e.getMessage());

            throw new DatabaseInitializationException(String.format(
                    "Erro de Conexão: Falha ao comunicar com o banco em '%s'. Detalhe: %s",
                    databaseConfiguration.getUrl(),
                    e.getMessage()
            ), e);
        } catch (ClassLoadingException e) {
            releaseQuietly(serviceRegistry, dataSource);
            log.error("""

            [ ERRO DE DRIVER ]
            Uma classe necessária para a conexão não foi encontrada.
            > Driver esperado: {}
            > Dialeto        : {}
            """, databaseConfiguration.getDriverClassName(), databaseConfiguration.getDialect());

            throw new DatabaseInitializationException("Falha de biblioteca: classe de driver ou dialeto não encontrada.", e);
        } catch (HibernateException e) {
            releaseQuietly(serviceRegistry, dataSource);
            log.error("""

            [ ERRO DE CONFIGURAÇÃO HIBERNATE ]
            Ocorreu um erro interno ao inicializar os serviços do Hibernate.
            > Verifique se o Dialeto ({}) é compatível com a versão do seu banco.
            > Detalhe técnico: {}
            """, databaseConfiguration.getDialect(), e.getMessage());

            throw new DatabaseInitializationException("Falha interna: Erro de configuração do ORM.", e);
        } catch (RuntimeException e) {
            releaseQuietly(serviceRegistry, dataSource);
            log.error("""

            [ ERRO INESPERADO ]
            Ocorreu uma falha não mapeada durante a criação da SessionFactory.
            > Tipo da Exceção: {}
            > Mensagem: {}
            """, e.getClass().getSimpleName(), e.getMessage());

            throw new DatabaseInitializationException("Erro crítico ao configurar a base de dados: " + e.getMessage(), e);
        }
    }

    private SessionFactoryContext createContext(DatabaseConfiguration databaseConfiguration, SessionFactory sessionFactory, HikariDataSource dataSource) {
        AtomicBoolean closed = new AtomicBoolean(false);
        return new SessionFactoryContext() {
            @Override
            public DatabaseConfiguration getDatabaseConfiguration() {
                return databaseConfiguration;
            }

            @Override
            public SessionFactory getSessionFactory() {
                return sessionFactory;
            }

            @Override
            public void close() {
                if (!closed.compareAndSet(false, true)) return;

                if (sessionFactory.isOpen()) {
                    log.debug("Fechando Hibernate SessionFactory...");
                    sessionFactory.close();
                }

                if (!dataSource.isClosed()) {
                    log.debug("Fechando Pool de Conexões Hikari ({})...", dataSource.getPoolName());
                    dataSource.close();
                }
            }
        };
    }

    private HikariConfig getHikariConfig(DatabaseConfiguration databaseConfiguration) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(databaseConfiguration.getUrl());
        hikariConfig.setUsername(databaseConfiguration.getUsername());
        hikariConfig.setPassword(databaseConfiguration.getPassword());
        hikariConfig.setDriverClassName(databaseConfiguration.getDriverClassName());

        hikariConfig.setAutoCommit(false);

        hikariConfig.setMaximumPoolSize(databaseConfiguration.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(databaseConfiguration.getMinimumIdle());
        hikariConfig.setIdleTimeout(databaseConfiguration.getIdleTimeout());
        hikariConfig.setConnectionTimeout(databaseConfiguration.getConnectionTimeout());
        hikariConfig.setPoolName("Kdao-HikariPool-" + simpleDialectName(databaseConfiguration.getDialect()));
        return hikariConfig;
    }

    private void registerGracefulShutdown(SessionFactoryContext context) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("""

        [ ENCERRANDO PERSISTÊNCIA ]
        Iniciando o fechamento gracioso dos recursos de banco de dados...
        """);

            try {
                context.close();
                log.info("Infraestrutura de persistência encerrada com sucesso.");
            } catch (RuntimeException e) {
                log.error("""

            [ ERRO NO SHUTDOWN ]
            Falha ao encerrar recursos de banco de dados.
            > Detalhe: {}
            """, e.getMessage(), e);
            }
        }, "Database-Shutdown-Hook"));
    }

    private void releaseQuietly(StandardServiceRegistry serviceRegistry, HikariDataSource dataSource) {
        try {
            if (serviceRegistry != null) {
                StandardServiceRegistryBuilder.destroy(serviceRegistry);
            }
        } catch (RuntimeException e) {
            log.warn("Falha ao destruir o registro de serviços do Hibernate: {}", e.getMessage(), e);
        }

        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
        }
    }

    private void validDatabaseConfiguration(DatabaseConfiguration databaseConfiguration) {

        if (databaseConfiguration == null) {
            log.error("""

            ╔════════════════════════════════════════════════════════════════════════════╗
            ║             ERRO CRÍTICO: CONFIGURAÇÃO DE BANCO AUSENTE                    ║
            ╠════════════════════════════════════════════════════════════════════════════╣
            ║  Nenhuma implementação de 'DatabaseConfiguration' foi informada.           ║
            ║  Construa o provedor de sessões com uma configuração válida.               ║
            ╚════════════════════════════════════════════════════════════════════════════╝
            """);

            throw new DatabaseInitializationException("A implementação de DatabaseConfiguration não foi fornecida (é nula).");
        }

        validateField(databaseConfiguration.getDriverClassName(), "Driver Class Name");
        validateField(databaseConfiguration.getUrl(), "Database URL");
        validateField(databaseConfiguration.getUsername(), "Database Username");
        validateField(databaseConfiguration.getPassword(), "Database Password");
        validateField(databaseConfiguration.getDialect(), "Hibernate Dialect");

        int size = 60;
        log.info("""

                ╔════════════════════════════════════════════════════════════════════════════╗
                ║              DATABASE CONFIGURATION LOADED                                 ║
                ╠════════════════════════════════════════════════════════════════════════════╣
                ║  -> Driver   : {}║
                ║  -> Dialect  : {}║
                ║  -> URL      : {}║
                ║  -> User     : {}║
                ║  -> Password : {}║
                ║  -> DDL Auto : {}║
                ║  -> Entities : {}║
                ╚════════════════════════════════════════════════════════════════════════════╝
                """,
                padRight(databaseConfiguration.getDriverClassName(), size),
                padRight(databaseConfiguration.getDialect(), size),
                padRight(databaseConfiguration.getUrl(), size),
                padRight(databaseConfiguration.getUsername(), size),
                padRight("[PROTECTED]", size),
                padRight(databaseConfiguration.getHbm2ddlAuto(), size),
                padRight(databaseConfiguration.getEntityClasses().size(), size)
        );
    }

    private void validateField(String value, String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            log.error("Falha na validação do banco de dados: O campo '{}' está vazio ou nulo.", fieldName);
            throw new DatabaseInitializationException("Configuração de banco inválida: O campo obrigatório '" + fieldName + "' não foi informado.");
        }
    }

    private String simpleDialectName(String dialect) {
        int lastDot = dialect.lastIndexOf('.');
        return lastDot >= 0 ? dialect.substring(lastDot + 1) : dialect;
    }

    private String padRight(Object value, int length) {
        String str = (value == null) ? "null" : value.toString();
        if (str.length() > length) {
            return str.substring(0, length);
        }
        return String.format("%-" + length + "s", str);
    }

}
