package dtm.dao.bootstrap;

import dtm.dao.repository.exceptions.DatabaseInitializationException;
import dtm.dao.repository.sessions.imple.HibernateSessionProvider;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Ponto de entrada da persistência: carrega {@code kdao.properties} do
 * classpath, aplica as sobrescritas {@code kdao.*} das propriedades de sistema
 * e devolve um {@link HibernateSessionProvider}. A SessionFactory só é
 * construída no primeiro acesso ao provedor.
 */
@Slf4j
public final class PersistenceBootstrap {

    public static final String DEFAULT_RESOURCE = "kdao.properties";
    public static final String PROPERTY_PREFIX = "kdao.";

    private PersistenceBootstrap() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static HibernateSessionProvider fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static HibernateSessionProvider fromClasspath(String resource) {
        return fromProperties(loadProperties(resource));
    }

    public static HibernateSessionProvider fromProperties(Properties properties) {
        return new HibernateSessionProvider(new PropertiesDatabaseConfiguration(properties));
    }

    public static Properties loadProperties(String resource) {
        Properties properties = new Properties();

        try (InputStream input = openResource(resource)) {
            if (input == null) {
                log.error("""

                [ CONFIGURAÇÃO AUSENTE ]
                O arquivo de configuração da persistência não foi encontrado no classpath.
                > Recurso esperado: {}
                """, resource);

                throw new DatabaseInitializationException("Recurso de configuração não encontrado no classpath: " + resource);
            }
            properties.load(input);
            log.info("Configuração de persistência carregada de: {}", resource);
        } catch (IOException e) {
            throw new DatabaseInitializationException("Falha ao ler o recurso de configuração: " + resource, e);
        }

        applySystemOverrides(properties);
        return properties;
    }

    private static void applySystemOverrides(Properties properties) {
        Properties systemProperties = System.getProperties();
        for (String key : systemProperties.stringPropertyNames()) {
            if (key.startsWith(PROPERTY_PREFIX)) {
                log.debug("Sobrescrevendo '{}' a partir das propriedades de sistema.", key);
                properties.setProperty(key, systemProperties.getProperty(key));
            }
        }
    }

    private static InputStream openResource(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = PersistenceBootstrap.class.getClassLoader();
        }
        return classLoader.getResourceAsStream(resource);
    }
}
