package dtm.dao.repository;

import dtm.dao.repository.exceptions.InvalidQueryOperationException;
import dtm.dao.repository.exceptions.RepositoryMetaInfoResolutionException;
import dtm.dao.repository.query.QueryCriteria;
import dtm.dao.repository.query.Sort;
import dtm.dao.repository.query.SortProperty;
import dtm.dao.repository.sessions.SessionSource;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Root;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.Session;
import org.hibernate.engine.internal.ForeignKeys;
import org.hibernate.engine.spi.SharedSessionContractImplementor;
import org.hibernate.query.Query;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Base dos repositórios Hibernate. Todas as operações usam a sessão obtida do
 * {@link SessionSource} informado: a sessão vinculada à thread (quando o
 * provedor é usado dentro de uma {@link dtm.dao.repository.sessions.UnitOfWork})
 * ou a própria unidade de trabalho passada explicitamente.
 *
 * @param <T>  tipo da entidade
 * @param <ID> tipo do identificador
 */
@Slf4j
public abstract class HibernateRepository<T, ID> implements CrudRepository<T, ID> {

    private final SessionSource sessionSource;
    private final Class<T> entityType;

    protected HibernateRepository(SessionSource sessionSource) {
        this.sessionSource = sessionSource;
        this.entityType = resolveEntityType();
    }

    protected HibernateRepository(SessionSource sessionSource, Class<T> entityType) {
        this.sessionSource = sessionSource;
        this.entityType = entityType;
    }

    @Override
    public T saveOrUpdate(T entity) {
        requireEntity(entity, "saveOrUpdate");
        return withSession(session -> saveOrUpdate(session, entity));
    }

    @Override
    public List<T> saveAll(Collection<T> entities) {
        if (entities == null) {
            throw new InvalidQueryOperationException("saveAll", getRepositoryName(), "a coleção de entidades é nula.");
        }
        entities.forEach(entity -> requireEntity(entity, "saveAll"));

        return withSession(session -> {
            List<T> saved = new ArrayList<>(entities.size());
            for (T entity : entities) {
                saved.add(saveOrUpdate(session, entity));
            }
            return saved;
        });
    }

    @Override
    public void delete(T entity) {
        requireEntity(entity, "delete");

        withSession(session -> {
            try {
                T entityToRemove = session.contains(entity) ? entity : session.merge(entity);
                session.remove(entityToRemove);
            } catch (RuntimeException e) {
                log.error("Falha ao remover entidade do tipo: {}", entityType.getName(), e);
                throw e;
            }
            return null;
        });
    }

    @Override
    public boolean deleteById(ID id) {
        requireId(id, "deleteById");

        return withSession(session -> {
            T entity = session.get(entityType, id);
            if (entity == null) {
                return false;
            }

            session.remove(entity);
            return true;
        });
    }

    @Override
    public void flush() {
        withSession(session -> {
            session.flush();
            return null;
        });
    }

    @Override
    public Optional<T> findById(ID id) {
        requireId(id, "findById");

        return withSession(session -> {
            try {
                return Optional.ofNullable(session.get(entityType, id));
            } catch (RuntimeException e) {
                log.error("Erro ao buscar entidade por ID no repositório: {}", getRepositoryName(), e);
                throw e;
            }
        });
    }

    @Override
    public Optional<T> findOne(QueryCriteria<T> criteria) {
        if (criteria == null) {
            throw new InvalidQueryOperationException("findOne", getRepositoryName(), "o critério de busca é nulo.");
        }

        return withSession(session -> {
            CriteriaBuilder builder = session.getCriteriaBuilder();
            CriteriaQuery<T> query = builder.createQuery(entityType);
            Root<T> root = query.from(entityType);
            query.select(root).where(criteria.toPredicate(root, query, builder));

            try {
                return session.createQuery(query)
                        .setCacheable(true)
                        .uniqueResultOptional();
            } catch (RuntimeException e) {
                log.error("Erro ao buscar entidade única no repositório: {}", getRepositoryName(), e);
                throw e;
            }
        });
    }

    @Override
    public List<T> findAll() {
        return findAll((QueryCriteria<T>) null);
    }

    @Override
    public List<T> findAll(QueryCriteria<T> criteria) {
        return findAll(criteria, null, -1, -1);
    }

    @Override
    public List<T> findAll(QueryCriteria<T> criteria, int firstResult, int maxResults) {
        return findAll(criteria, null, firstResult, maxResults);
    }

    @Override
    public List<T> findAll(Sort sort) {
        return findAll(sort, -1, -1);
    }

    @Override
    public List<T> findAll(int firstResult, int maxResults) {
        return findAll((QueryCriteria<T>) null, firstResult, maxResults);
    }

    @Override
    public List<T> findAll(Sort sort, int firstResult, int maxResults) {
        return findAll(null, sort, firstResult, maxResults);
    }

    /**
     * Valores negativos de {@code firstResult} e {@code maxResults} desativam a paginação.
     */
    @Override
    public List<T> findAll(QueryCriteria<T> criteria, Sort sort, int firstResult, int maxResults) {
        return withSession(session -> {
            CriteriaBuilder builder = session.getCriteriaBuilder();
            CriteriaQuery<T> criteriaQuery = builder.createQuery(entityType);
            Root<T> root = criteriaQuery.from(entityType);
            criteriaQuery.select(root);

            if (criteria != null) {
                criteriaQuery.where(criteria.toPredicate(root, criteriaQuery, builder));
            }

            if (sort != null && !sort.isUnsorted()) {
                List<Order> orders = new ArrayList<>();
                for (SortProperty sortProperty : sort.getProperties()) {
                    orders.add(sortProperty.isAscending()
                            ? builder.asc(root.get(sortProperty.property()))
                            : builder.desc(root.get(sortProperty.property())));
                }
                criteriaQuery.orderBy(orders);
            }

            try {
                Query<T> query = session.createQuery(criteriaQuery);

                if (firstResult >= 0) {
                    query.setFirstResult(firstResult);
                }

                if (maxResults >= 0) {
                    query.setMaxResults(maxResults);
                }

                return query
                        .setCacheable(true)
                        .getResultList();
            } catch (RuntimeException e) {
                log.error("Erro ao buscar entidades no repositório: {}", getRepositoryName(), e);
                throw e;
            }
        });
    }

    @Override
    public long count() {
        return count(null);
    }

    @Override
    public long count(QueryCriteria<T> criteria) {
        return withSession(session -> {
            CriteriaBuilder builder = session.getCriteriaBuilder();
            CriteriaQuery<Long> query = builder.createQuery(Long.class);
            Root<T> root = query.from(entityType);
            query.select(builder.count(root));

            if (criteria != null) {
                query.where(criteria.toPredicate(root, query, builder));
            }

            return session.createQuery(query)
                    .setCacheable(true)
                    .getSingleResult();
        });
    }

    public Class<T> getEntityType() {
        return entityType;
    }

    protected SessionSource getSessionSource() {
        return sessionSource;
    }

    protected <R> R withSession(Function<Session, R> work) {
        return sessionSource.withSession(work);
    }

    private T saveOrUpdate(Session session, T entity) {
        try {
            if (session.contains(entity)) {
                return entity;
            }

            if (isTransient(session, entity)) {
                session.persist(entity);
                return entity;
            }

            return session.merge(entity);
        } catch (RuntimeException e) {
            log.error("Falha ao persistir entidade do tipo: {}", entityType.getName(), e);
            throw e;
        }
    }

    /**
     * Usa a regra de unsaved-value do Hibernate: identificador nulo, valor
     * padrão de id primitivo, versão ou, em último caso, snapshot do banco.
     */
    private boolean isTransient(Session session, T entity) {
        SharedSessionContractImplementor sessionImplementor = session.unwrap(SharedSessionContractImplementor.class);
        return ForeignKeys.isTransient(null, entity, null, sessionImplementor);
    }

    private void requireEntity(T entity, String operation) {
        if (entity == null) {
            throw new InvalidQueryOperationException(operation, getRepositoryName(), "a entidade informada é nula.");
        }
    }

    private void requireId(ID id, String operation) {
        if (id == null) {
            throw new InvalidQueryOperationException(operation, getRepositoryName(), "o ID da entidade deve ser fornecido.");
        }
    }

    private String getRepositoryName() {
        return getClass().getSimpleName();
    }

    @SuppressWarnings("unchecked")
    private Class<T> resolveEntityType() {
        Class<?> current = getClass();
        while (current != null && current != HibernateRepository.class) {
            Type genericSuperclass = current.getGenericSuperclass();
            if (genericSuperclass instanceof ParameterizedType parameterizedType) {
                Type entityArgument = parameterizedType.getActualTypeArguments()[0];
                if (entityArgument instanceof Class<?> entityClass) {
                    return (Class<T>) entityClass;
                }
            }
            current = current.getSuperclass();
        }

        log.error("""

            [ ERRO DE RESOLUÇÃO DE REPOSITÓRIO ]
            Não foi possível determinar o tipo da entidade do repositório.
            > Repositório   : {}
            > Possível Causa: O repositório não declara tipos concretos, ex: extends HibernateRepository<Pessoa, Long>
            """, getClass().getName());

        throw new RepositoryMetaInfoResolutionException(
                "Falha ao resolver o tipo de entidade para " + getClass().getSimpleName() +
                        ". Declare tipos genéricos concretos ou informe a classe da entidade no construtor."
        );
    }
}
