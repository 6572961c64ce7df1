package dtm.dao.repository.query;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.Objects;

/**
 * Filtro sobre os campos de uma entidade, expresso com a Criteria API.
 *
 * @param <T> tipo da entidade
 */
@FunctionalInterface
public interface QueryCriteria<T> {

    Predicate toPredicate(Root<T> root, CriteriaQuery<?> query, CriteriaBuilder builder);

    default QueryCriteria<T> and(QueryCriteria<T> other) {
        Objects.requireNonNull(other, "other");
        return (root, query, builder) -> builder.and(
                toPredicate(root, query, builder),
                other.toPredicate(root, query, builder)
        );
    }

    default QueryCriteria<T> or(QueryCriteria<T> other) {
        Objects.requireNonNull(other, "other");
        return (root, query, builder) -> builder.or(
                toPredicate(root, query, builder),
                other.toPredicate(root, query, builder)
        );
    }

    static <T> QueryCriteria<T> not(QueryCriteria<T> criteria) {
        Objects.requireNonNull(criteria, "criteria");
        return (root, query, builder) -> builder.not(criteria.toPredicate(root, query, builder));
    }

    static <T> QueryCriteria<T> equal(String property, Object value) {
        return (root, query, builder) -> value == null
                ? builder.isNull(root.get(property))
                : builder.equal(root.get(property), value);
    }

    static <T> QueryCriteria<T> like(String property, String pattern) {
        return (root, query, builder) -> builder.like(root.<String>get(property), pattern);
    }
}
