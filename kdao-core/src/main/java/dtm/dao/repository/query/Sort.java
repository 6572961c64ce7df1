package dtm.dao.repository.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Sequência ordenada de propriedades de ordenação. A ordem de inclusão é a
 * ordem aplicada na consulta.
 */
public final class Sort {

    private final List<SortProperty> properties;

    private Sort(List<SortProperty> properties) {
        this.properties = Collections.unmodifiableList(properties);
    }

    public static Sort by(String property) {
        return by(property, SortDirection.ASCENDING);
    }

    public static Sort by(String property, SortDirection direction) {
        List<SortProperty> properties = new ArrayList<>();
        properties.add(new SortProperty(property, direction));
        return new Sort(properties);
    }

    /**
     * Converte um mapa propriedade/direção; use um {@link java.util.LinkedHashMap}
     * para preservar a ordem.
     */
    public static Sort of(Map<String, SortDirection> sortProperties) {
        List<SortProperty> properties = new ArrayList<>();
        sortProperties.forEach((property, direction) -> properties.add(new SortProperty(property, direction)));
        return new Sort(properties);
    }

    public static Sort unsorted() {
        return new Sort(new ArrayList<>());
    }

    public Sort and(String property, SortDirection direction) {
        List<SortProperty> merged = new ArrayList<>(properties);
        merged.add(new SortProperty(property, direction));
        return new Sort(merged);
    }

    public Sort and(String property) {
        return and(property, SortDirection.ASCENDING);
    }

    public List<SortProperty> getProperties() {
        return properties;
    }

    public boolean isUnsorted() {
        return properties.isEmpty();
    }

    @Override
    public String toString() {
        return "Sort" + properties;
    }
}
