package de.t14d3.clientdb.test;

import com.fasterxml.jackson.databind.JsonNode;
import de.t14d3.clientdb.config.ClientDbConfig;
import de.t14d3.clientdb.core.ClientDb;
import de.t14d3.clientdb.event.ObjEventType;
import de.t14d3.clientdb.exceptions.ConfigurationException;
import de.t14d3.clientdb.exceptions.IntegrityException;
import de.t14d3.clientdb.store.JdbcStoreAdapter;
import de.t14d3.clientdb.store.StoreAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static de.t14d3.clientdb.test.TestSupport.json;
import static org.junit.jupiter.api.Assertions.*;

public class ReferenceResolverTest {
    private static final String ORDERS_OF_CUSTOMER = "customers/1/orders";

    private String jdbcUrl;
    private FakeRemoteDataSource remote;
    private ClientDb db;

    @BeforeEach
    void setup() {
        jdbcUrl = TestSupport.uniqueH2Url();
        remote = new FakeRemoteDataSource()
                .respond(ORDERS_OF_CUSTOMER, json("[{\"id\":10,\"customerId\":1},{\"id\":11,\"customerId\":\"1\"}]"));
        db = open(remote);
    }

    @AfterEach
    void teardown() {
        db.close();
    }

    private ClientDb open(FakeRemoteDataSource source) {
        return open(source, JdbcStoreAdapter.open(jdbcUrl));
    }

    private ClientDb open(FakeRemoteDataSource source, StoreAdapter store) {
        ClientDbConfig config = TestSupport.config(jdbcUrl)
                .invalidationExecutor(new ManualExecutor())
                .build();
        ClientDb clientDb = new ClientDb(source, store, config);
        clientDb.init();
        return clientDb;
    }

    private List<JsonNode> ordersOfCustomer(ClientDb clientDb) {
        return clientDb.getObjRefCollection("customers", 1, "orders", "orders", "customerId");
    }

    private static List<Integer> ids(List<JsonNode> objs) {
        return objs.stream().map(o -> o.get("id").asInt()).collect(Collectors.toList());
    }

    @Test
    void testCollectionRelationIsServedLocallyAfterFirstFetch() {
        List<JsonNode> first = ordersOfCustomer(db);
        List<JsonNode> second = ordersOfCustomer(db);

        assertEquals(List.of(10, 11), ids(first));
        assertEquals(List.of(10, 11), ids(second));
        assertEquals(1, remote.callCount(ORDERS_OF_CUSTOMER));
    }

    @Test
    void testRelatedObjectsAreCachedUnderTheirOwnKeys() {
        ordersOfCustomer(db);

        assertNotNull(db.getObj("orders", 10));
        assertNotNull(db.getObj("orders", 11));
        assertEquals(0, remote.callCount("orders/10"));
        assertEquals("customers", db.peek("orders", 10).orElseThrow().refCollection());
        assertEquals(1L, db.countByCollection().get("customers:REF:orders"));
    }

    @Test
    void testMissingRelatedRowTriggersOneRefetch() {
        ordersOfCustomer(db);
        db.delete("orders", 11);

        List<JsonNode> refetched = ordersOfCustomer(db);

        assertEquals(List.of(10, 11), ids(refetched));
        assertEquals(2, remote.callCount(ORDERS_OF_CUSTOMER));
        assertEquals(2L, db.countByCollection().get("orders"));

        ordersOfCustomer(db);
        assertEquals(2, remote.callCount(ORDERS_OF_CUSTOMER));
    }

    @Test
    void testListenerRereadingRelationDoesNotBlock() {
        List<List<JsonNode>> reread = new CopyOnWriteArrayList<>();
        db.addListener(event -> {
            if (event.type() == ObjEventType.SET && event.collection().equals("orders")) {
                reread.add(ordersOfCustomer(db));
            }
        });

        List<JsonNode> fetched = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> ordersOfCustomer(db));

        assertEquals(List.of(10, 11), ids(fetched));
        assertEquals(2, reread.size());
        reread.forEach(objs -> assertEquals(List.of(10, 11), ids(objs)));
        assertEquals(1, remote.callCount(ORDERS_OF_CUSTOMER));
    }

    @Test
    void testRelationIsRestoredFromStore() {
        ordersOfCustomer(db);
        db.close();

        FakeRemoteDataSource otherRemote = new FakeRemoteDataSource();
        db = open(otherRemote);

        assertEquals(List.of(10, 11), ids(ordersOfCustomer(db)));
        assertTrue(otherRemote.calls().isEmpty());
    }

    @Test
    void testStoreIsScannedOnceUntilRelatedCollectionIsWritten() {
        ordersOfCustomer(db);
        db.close();
        CountingStoreAdapter store = new CountingStoreAdapter(JdbcStoreAdapter.open(jdbcUrl));
        db = open(new FakeRemoteDataSource(), store);

        int beforeFirst = store.queryCount();
        assertEquals(List.of(10, 11), ids(ordersOfCustomer(db)));
        assertTrue(store.queryCount() > beforeFirst);
        assertEquals(1, db.loadedRefCount());

        int beforeSecond = store.queryCount();
        assertEquals(List.of(10, 11), ids(ordersOfCustomer(db)));
        assertEquals(beforeSecond, store.queryCount());
        assertEquals(1, db.loadedRefCount());

        db.set("orders", json("{\"id\":12,\"customerId\":2}"));
        assertEquals(0, db.loadedRefCount());
    }

    @Test
    void testLoadedRelationIsForgottenWhenBaseIsResetWithRefs() {
        ordersOfCustomer(db);
        ordersOfCustomer(db);
        assertEquals(1, db.loadedRefCount());

        db.reset("customers", 1, true);

        assertEquals(0, db.loadedRefCount());
    }

    @Test
    void testDuplicateStoredRowFailsRelationScan() throws Exception {
        ordersOfCustomer(db);
        db.close();
        db = open(new FakeRemoteDataSource());
        try (Connection connection = DriverManager.getConnection(jdbcUrl);
             Statement statement = connection.createStatement()) {
            statement.execute("DROP INDEX \"OBJSINDEX\"");
            statement.execute("INSERT INTO \"OBJS\" (\"EXPIRES\", \"COLLECTION\", \"REFCOLLECTION\", \"OBJID\", \"OBJ\") " +
                    "VALUES (0, 'orders', 'customers', '10', '{\"id\":10,\"customerId\":1}')");
        }

        assertThrows(IntegrityException.class, () -> ordersOfCustomer(db));
    }

    @Test
    void testResetWithRefsDropsRelationSnapshot() {
        ordersOfCustomer(db);

        db.reset("customers", 1, true);

        assertNull(db.countByCollection().get("customers:REF:orders"));
        assertTrue(db.peek("orders", 10).isPresent());
        ordersOfCustomer(db);
        assertEquals(2, remote.callCount(ORDERS_OF_CUSTOMER));
    }

    @Test
    void testSingleRelationInfersPropertyAndResolvesLocally() {
        remote.respond("orders/10/customer", json("{\"id\":1,\"name\":\"acme\"}"));
        db.set("orders", json("{\"id\":10,\"customerId\":1}"));

        JsonNode first = db.getObjRefSingle("orders", 10, "customers", null, "customerId");
        JsonNode second = db.getObjRefSingle("orders", 10, "customers", null, "customerId");

        assertEquals("acme", first.get("name").asText());
        assertEquals(first, second);
        assertEquals(1, remote.callCount("orders/10/customer"));
        assertEquals("acme", db.getObj("customers", 1).get("name").asText());
    }

    @Test
    void testSingleRelationRefetchesWhenForeignKeyUnresolvable() {
        remote.respond("orders/10/customer", json("{\"id\":1}"));

        db.getObjRefSingle("orders", 10, "customers", "customer", "customerId");
        db.getObjRefSingle("orders", 10, "customers", "customer", "customerId");

        // the base order was never cached, so its foreign key cannot be followed
        assertEquals(2, remote.callCount("orders/10/customer"));
    }

    @Test
    void testUninferablePropertyFails() {
        assertThrows(ConfigurationException.class,
                () -> db.getObjRefSingle("orders", 10, "customers", null, "customer"));
        assertTrue(remote.calls().isEmpty());
    }

    @Test
    void testArityMismatchFails() {
        remote.respond("customers/2/orders", json("{\"id\":12,\"customerId\":2}"));
        remote.respond("orders/12/customer", json("[{\"id\":2}]"));

        assertThrows(ConfigurationException.class,
                () -> db.getObjRefCollection("customers", 2, "orders", "orders", "customerId"));
        assertThrows(ConfigurationException.class,
                () -> db.getObjRefSingle("orders", 12, "customers", "customer", "customerId"));
    }

    @Test
    void testRelatedItemWithoutPrimaryKeyFails() {
        remote.respond("customers/3/orders", json("[{\"customerId\":3}]"));

        assertThrows(ConfigurationException.class,
                () -> db.getObjRefCollection("customers", 3, "orders", "orders", "customerId"));
    }

    @Test
    void testEmptyRelationSourceReturnsNull() {
        assertNull(db.getObjRefCollection("customers", 9, "orders", "orders", "customerId"));
        assertNull(db.getObjRefSingle("orders", null, "customers", "customer", "customerId"));
    }
}
