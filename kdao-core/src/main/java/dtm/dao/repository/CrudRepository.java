package dtm.dao.repository;

import dtm.dao.repository.query.QueryCriteria;
import dtm.dao.repository.query.Sort;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CrudRepository<S, ID> {

    S saveOrUpdate(S entity);

    List<S> saveAll(Collection<S> entities);



    void delete(S entity);

    boolean deleteById(ID id);

    void flush();



    Optional<S> findById(ID id);

    Optional<S> findOne(QueryCriteria<S> criteria);

    List<S> findAll();

    List<S> findAll(QueryCriteria<S> criteria);

    List<S> findAll(QueryCriteria<S> criteria, int firstResult, int maxResults);

    List<S> findAll(QueryCriteria<S> criteria, Sort sort, int firstResult, int maxResults);

    List<S> findAll(Sort sort);

    List<S> findAll(int firstResult, int maxResults);

    List<S> findAll(Sort sort, int firstResult, int maxResults);

    long count();

    long count(QueryCriteria<S> criteria);
}
