package dtm.dao.repository;

import dtm.dao.repository.exceptions.InvalidQueryOperationException;
import dtm.dao.repository.exceptions.RepositoryMetaInfoResolutionException;
import dtm.dao.repository.fixtures.Gadget;
import dtm.dao.repository.fixtures.GadgetRepository;
import dtm.dao.repository.fixtures.Person;
import dtm.dao.repository.fixtures.PersonRepository;
import dtm.dao.repository.query.QueryCriteria;
import dtm.dao.repository.query.Sort;
import dtm.dao.repository.query.SortDirection;
import dtm.dao.repository.sessions.SessionSource;
import dtm.dao.repository.sessions.UnitOfWork;
import org.hibernate.NonUniqueResultException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HibernateRepositoryTest extends BaseRepositoryTest {

    private static final QueryCriteria<Person> ADULTS =
            (root, query, builder) -> builder.greaterThanOrEqualTo(root.<Integer>get("age"), 18);

    @Test
    public void testSaveDeleteScenario() {
        Person saved = personRepository.saveOrUpdate(new Person("A"));
        assertThat(saved.getId()).isEqualTo(1);

        Optional<Person> found = personRepository.findById(1);
        assertThat(found).hasValueSatisfying(person -> {
            assertThat(person.getId()).isEqualTo(1);
            assertThat(person.getName()).isEqualTo("A");
        });

        personRepository.delete(found.get());

        assertThat(personRepository.findById(1)).isEmpty();
        assertThat(personRepository.count()).isZero();
    }

    @Test
    public void testFindByIdReturnsPersistedState() {
        Person saved = personRepository.saveOrUpdate(new Person("Ana", 31));

        assertThat(personRepository.findById(saved.getId())).contains(saved);
    }

    @Test
    public void testFindByIdOfUnknownIdentifierIsEmpty() {
        assertThat(personRepository.findById(42)).isEmpty();
    }

    @Test
    public void testSaveOrUpdateMergesDetachedEntity() {
        Person saved = personRepository.saveOrUpdate(new Person("Bruno", 20));

        saved.setName("Bruno Silva");
        Person updated = personRepository.saveOrUpdate(saved);

        assertThat(updated.getId()).isEqualTo(saved.getId());
        assertThat(personRepository.findById(saved.getId()))
                .map(Person::getName)
                .contains("Bruno Silva");
        assertThat(personRepository.count()).isEqualTo(1);
    }

    @Test
    public void testSaveOrUpdateWithPrimitiveIdentifierInsertsOnceThenUpdates() {
        GadgetRepository gadgetRepository = new GadgetRepository(sessionProvider);
        Gadget gadget = new Gadget("A");

        try (UnitOfWork unitOfWork = new UnitOfWork(sessionProvider)) {
            assertThat(gadgetRepository.saveOrUpdate(gadget)).isSameAs(gadget);
        }
        assertThat(gadget.getId()).isPositive();

        gadget.setName("B");
        try (UnitOfWork unitOfWork = new UnitOfWork(sessionProvider)) {
            gadgetRepository.saveOrUpdate(gadget);
        }

        assertThat(gadgetRepository.count()).isEqualTo(1);
        assertThat(gadgetRepository.findById(gadget.getId()))
                .map(Gadget::getName)
                .contains("B");
    }

    @Test
    public void testSaveAllAssignsIdentifiers() {
        List<Person> saved = personRepository.saveAll(List.of(
                new Person("Carla", 40),
                new Person("Davi", 12),
                new Person("Elis", 25)
        ));

        assertThat(saved).extracting(Person::getId).doesNotContainNull();
        assertThat(personRepository.count()).isEqualTo(3);
    }

    @Test
    public void testDeleteById() {
        Person saved = personRepository.saveOrUpdate(new Person("Fabio"));

        assertThat(personRepository.deleteById(saved.getId())).isTrue();
        assertThat(personRepository.deleteById(saved.getId())).isFalse();
        assertThat(personRepository.findById(saved.getId())).isEmpty();
    }

    @Test
    public void testCountMatchesListSizeForEveryCriteria() {
        savePeople();

        List<QueryCriteria<Person>> criteriaList = Arrays.asList(
                null,
                ADULTS,
                QueryCriteria.equal("name", "p3"),
                QueryCriteria.equal("name", "nobody"),
                QueryCriteria.not(ADULTS).or(QueryCriteria.like("name", "p%"))
        );

        for (QueryCriteria<Person> criteria : criteriaList) {
            assertThat(personRepository.count(criteria))
                    .isEqualTo(personRepository.findAll(criteria).size());
        }
        assertThat(personRepository.count()).isEqualTo(personRepository.findAll().size());
    }

    @Test
    public void testFindAllWindowFollowsSortOrder() {
        savePeople();

        List<Person> window = personRepository.findAll(Sort.by("age", SortDirection.DESCENDING), 1, 2);

        assertThat(window).extracting(Person::getAge).containsExactly(40, 30);
    }

    @Test
    public void testFindAllWithCriteriaSortAndPaging() {
        savePeople();

        List<Person> adults = personRepository.findAll(ADULTS, Sort.by("age"), 1, 10);

        assertThat(adults).extracting(Person::getAge).containsExactly(30, 40, 50);
    }

    @Test
    public void testFindAllWithNegativePagingIsUnbounded() {
        savePeople();

        assertThat(personRepository.findAll(-1, -1)).hasSize(5);
        assertThat(personRepository.findAll(ADULTS, -1, -1)).hasSize(4);
        assertThat(personRepository.findAll(0, 3)).hasSize(3);
    }

    @Test
    public void testFindAllSortsByEveryPropertyInOrder() {
        personRepository.saveAll(List.of(
                new Person("b", 30),
                new Person("c", 20),
                new Person("a", 30)
        ));

        List<Person> sorted = personRepository.findAll(Sort.by("age", SortDirection.DESCENDING).and("name"));

        assertThat(sorted).extracting(Person::getName).containsExactly("a", "b", "c");
    }

    @Test
    public void testFindOne() {
        savePeople();

        assertThat(personRepository.findByName("p2")).map(Person::getAge).contains(20);
        assertThat(personRepository.findByName("nobody")).isEmpty();
    }

    @Test
    public void testFindOneWithMultipleMatchesFails() {
        personRepository.saveAll(List.of(new Person("dup", 1), new Person("dup", 2)));

        assertThatThrownBy(() -> personRepository.findByName("dup"))
                .isInstanceOf(NonUniqueResultException.class);
    }

    @Test
    public void testRepositoryBoundToExplicitUnitOfWork() {
        try (UnitOfWork unitOfWork = new UnitOfWork(sessionProvider)) {
            PersonRepository scoped = new PersonRepository(unitOfWork);
            scoped.saveOrUpdate(new Person("scoped"));

            assertThat(scoped.count()).isEqualTo(1);
        }

        assertThat(personRepository.findAll()).extracting(Person::getName).containsExactly("scoped");
    }

    @Test
    public void testNullArgumentsAreRejected() {
        assertThatThrownBy(() -> personRepository.saveOrUpdate(null)).isInstanceOf(InvalidQueryOperationException.class);
        assertThatThrownBy(() -> personRepository.delete(null)).isInstanceOf(InvalidQueryOperationException.class);
        assertThatThrownBy(() -> personRepository.findById(null)).isInstanceOf(InvalidQueryOperationException.class);
        assertThatThrownBy(() -> personRepository.findOne(null)).isInstanceOf(InvalidQueryOperationException.class);
        assertThatThrownBy(() -> personRepository.saveAll(null)).isInstanceOf(InvalidQueryOperationException.class);
    }

    @Test
    public void testEntityTypeResolvedFromGenericDeclaration() {
        assertThat(personRepository.getEntityType()).isEqualTo(Person.class);
        assertThat(new HibernateRepository<Person, Integer>(sessionProvider) { }.getEntityType()).isEqualTo(Person.class);
    }

    @Test
    public void testUnresolvableEntityTypeFails() {
        assertThatThrownBy(() -> new GenericRepository<Person>(sessionProvider))
                .isInstanceOf(RepositoryMetaInfoResolutionException.class);
    }

    private void savePeople() {
        personRepository.saveAll(List.of(
                new Person("p1", 10),
                new Person("p2", 20),
                new Person("p3", 30),
                new Person("p4", 40),
                new Person("p5", 50)
        ));
    }

    private static class GenericRepository<T> extends HibernateRepository<T, Integer> {
        GenericRepository(SessionSource sessionSource) {
            super(sessionSource);
        }
    }
}
