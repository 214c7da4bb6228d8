package dtm.hexdi.storage.graph;

import dtm.hexdi.exceptions.DependencyContainerException;
import dtm.hexdi.exceptions.DuplicateProviderException;
import dtm.hexdi.exceptions.MissingDependencyException;
import dtm.hexdi.prototypes.Adapter;
import dtm.hexdi.prototypes.Lifetime;
import dtm.hexdi.prototypes.Port;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GraphBuilderTest {

    interface Logger {}
    interface Database {}
    interface UserService {}
    interface Cache {}

    static final Port<Logger> LOGGER = Port.of("Logger", Logger.class);
    static final Port<Database> DATABASE = Port.of("Database", Database.class);
    static final Port<UserService> USER_SERVICE = Port.of("UserService", UserService.class);
    static final Port<Cache> CACHE = Port.of("Cache", Cache.class);

    static final Adapter<Logger> LOGGER_ADAPTER = Adapter.builder(LOGGER)
            .factory(deps -> new Logger() {})
            .build();

    static final Adapter<Database> DATABASE_ADAPTER = Adapter.builder(DATABASE)
            .requires(LOGGER)
            .factory(deps -> new Database() {})
            .build();

    static final Adapter<UserService> USER_SERVICE_ADAPTER = Adapter.builder(USER_SERVICE)
            .requires(LOGGER, DATABASE)
            .lifetime(Lifetime.SCOPED)
            .factory(deps -> new UserService() {})
            .build();

    @Test
    void buildsGraphWithOneAdapterPerProvideCall() {
        Graph graph = GraphBuilder.create()
                .provide(LOGGER_ADAPTER)
                .provide(DATABASE_ADAPTER)
                .provide(USER_SERVICE_ADAPTER)
                .build();

        assertEquals(3, graph.size());
        assertEquals(List.of(LOGGER_ADAPTER, DATABASE_ADAPTER, USER_SERVICE_ADAPTER), graph.getAdapters());
    }

    @Test
    void reportsMissingDependencyWithOneMessagePerPort() {
        Adapter<UserService> userService = Adapter.builder(USER_SERVICE)
                .requires(DATABASE)
                .factory(deps -> new UserService() {})
                .build();

        MissingDependencyException error = assertThrows(MissingDependencyException.class,
                () -> GraphBuilder.create().provide(userService).build());

        assertEquals(Set.of("Database"), error.getMissingPorts());
        assertEquals(List.of("Missing dependencies: Database"), error.getMessages());
        assertEquals("MISSING_DEPENDENCY", error.getCode());
    }

    @Test
    void missingSetIsRequiredMinusProvided() {
        GraphBuilder builder = GraphBuilder.create().provide(USER_SERVICE_ADAPTER);

        MissingDependencyException error = assertThrows(MissingDependencyException.class, builder::build);

        assertEquals(Set.of("Database", "Logger"), error.getMissingPorts());
        assertEquals("Missing dependencies: Database\nMissing dependencies: Logger", error.getMessage());
        assertFalse(builder.isComplete());
        assertEquals(Set.of("Database", "Logger"), builder.getMissingPorts());
    }

    @Test
    void duplicateProviderFailsInEitherOrder() {
        Adapter<Logger> otherLogger = Adapter.builder(LOGGER)
                .lifetime(Lifetime.REQUEST)
                .factory(deps -> new Logger() {})
                .build();

        DuplicateProviderException first = assertThrows(DuplicateProviderException.class,
                () -> GraphBuilder.create().provide(LOGGER_ADAPTER).provide(otherLogger));
        DuplicateProviderException second = assertThrows(DuplicateProviderException.class,
                () -> GraphBuilder.create().provide(otherLogger).provide(LOGGER_ADAPTER));

        assertEquals("Logger", first.getPortName());
        assertEquals("Logger", second.getPortName());
        assertTrue(first.isProgrammingError());
    }

    @Test
    void provideOrderDoesNotAffectValidation() {
        List<List<Adapter<?>>> orders = List.of(
                List.of(LOGGER_ADAPTER, DATABASE_ADAPTER, USER_SERVICE_ADAPTER),
                List.of(USER_SERVICE_ADAPTER, DATABASE_ADAPTER, LOGGER_ADAPTER),
                List.of(DATABASE_ADAPTER, USER_SERVICE_ADAPTER, LOGGER_ADAPTER)
        );

        for (List<Adapter<?>> order : orders) {
            assertEquals(3, GraphBuilder.create().provideAll(order).build().size());
        }
    }

    @Test
    void builderIsImmutableAndCanBranch() {
        GraphBuilder base = GraphBuilder.create().provide(LOGGER_ADAPTER);
        GraphBuilder withDatabase = base.provide(DATABASE_ADAPTER);

        Adapter<Database> fakeDatabase = Adapter.builder(DATABASE)
                .factory(deps -> new Database() {})
                .build();
        GraphBuilder withFake = base.provide(fakeDatabase);

        assertEquals(1, base.size());
        assertSame(DATABASE_ADAPTER, withDatabase.build().getAdapter("Database"));
        assertSame(fakeDatabase, withFake.build().getAdapter("Database"));
    }

    @Test
    void emptyBuilderBuildsEmptyGraph() {
        Graph graph = GraphBuilder.create().build();

        assertTrue(graph.isEmpty());
        assertTrue(graph.getDependencyLayers().isEmpty());
        assertTrue(GraphBuilder.create().isComplete());
    }

    @Test
    void mergeAppliesDuplicateDetection() {
        GraphBuilder left = GraphBuilder.create().provide(LOGGER_ADAPTER);
        GraphBuilder right = GraphBuilder.create().provide(DATABASE_ADAPTER);

        Graph merged = left.merge(right).build();
        assertEquals(Set.of("Logger", "Database"), merged.getPortNames());

        assertThrows(DuplicateProviderException.class, () -> left.merge(left));
    }

    @Test
    void tracksProvidedAndRequiredPorts() {
        GraphBuilder builder = GraphBuilder.create().provideAll(DATABASE_ADAPTER, USER_SERVICE_ADAPTER);

        assertEquals(Set.of("Database", "UserService"), builder.getProvidedPorts());
        assertEquals(Set.of("Logger", "Database"), builder.getRequiredPorts());
        assertEquals(Set.of("Logger"), builder.getMissingPorts());
        assertTrue(builder.provides(DATABASE));
        assertFalse(builder.provides(CACHE));
    }

    @Test
    void buildErrorsShareTheContainerHierarchy() {
        assertThrows(DependencyContainerException.class,
                () -> GraphBuilder.create().provide(DATABASE_ADAPTER).build());
    }
}
