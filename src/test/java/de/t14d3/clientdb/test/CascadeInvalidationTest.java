package de.t14d3.clientdb.test;

import de.t14d3.clientdb.config.ClientDbConfig;
import de.t14d3.clientdb.core.ClientDb;
import de.t14d3.clientdb.event.ObjEvent;
import de.t14d3.clientdb.event.ObjEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static de.t14d3.clientdb.test.TestSupport.json;
import static org.junit.jupiter.api.Assertions.*;

public class CascadeInvalidationTest {
    private ManualExecutor executor;
    private RecordingListener listener;
    private ClientDb db;

    @AfterEach
    void teardown() {
        if (db != null) {
            db.close();
        }
    }

    private void open(ClientDbConfig.Builder builder) {
        open(builder, new FakeRemoteDataSource());
    }

    private void open(ClientDbConfig.Builder builder, FakeRemoteDataSource remote) {
        executor = new ManualExecutor();
        listener = new RecordingListener();
        db = ClientDb.create(remote, builder.invalidationExecutor(executor).build());
        db.init();
        db.addListener(listener);
    }

    private ClientDbConfig.Builder ordersDependOnCustomers() {
        return TestSupport.config(TestSupport.uniqueH2Url())
                .relation("orders", "customers", true);
    }

    @Test
    void testDeleteOnDependencyResetsDependentOnNextPass() {
        open(ordersDependOnCustomers());
        db.set("orders", json("{\"id\":1}"));
        db.set("customers", json("{\"id\":1}"));

        db.delete("customers", 1);

        assertTrue(listener.ofType(ObjEventType.RESET_COLLECTION).isEmpty());
        assertEquals(1, executor.pendingTasks());

        executor.runAll();

        List<ObjEvent> resets = listener.ofType(ObjEventType.RESET_COLLECTION);
        assertEquals(1, resets.size());
        assertEquals("orders", resets.get(0).collection());
        assertEquals("", resets.get(0).id());
        assertTrue(db.peek("orders", 1).isEmpty());
        assertNull(db.countByCollection().get("orders"));
    }

    @Test
    void testRowsTaggedWithDependentAreRemoved() {
        FakeRemoteDataSource remote = new FakeRemoteDataSource()
                .respond("orders/1/lines", json("[{\"id\":5,\"orderId\":1}]"));
        open(ordersDependOnCustomers(), remote);
        db.getObjRefCollection("orders", 1, "lines", "lines", "orderId");
        assertEquals("orders", db.peek("lines", 5).orElseThrow().refCollection());

        db.reset("customers", 1);
        executor.runAll();

        assertTrue(db.peek("lines", 5).isEmpty());
        assertNull(db.countByCollection().get("orders:REF:lines"));
    }

    @Test
    void testSetDoesNotCascade() {
        open(ordersDependOnCustomers());

        db.set("customers", json("{\"id\":1}"));

        assertEquals(0, executor.pendingTasks());
    }

    @Test
    void testQueuedCollectionsCoalesce() {
        open(ordersDependOnCustomers());

        db.reset("customers", 1);
        db.reset("customers", 2);
        db.resetCollection("customers");

        assertEquals(1, executor.pendingTasks());
        executor.runAll();
        assertEquals(1, listener.ofType(ObjEventType.RESET_COLLECTION).stream()
                .filter(e -> e.collection().equals("orders")).count());
    }

    @Test
    void testCyclicRelationsTerminate() {
        open(ordersDependOnCustomers().relation("customers", "orders", true));

        db.delete("customers", 1);
        int tasks = executor.runAll();

        assertEquals(1, tasks);
        List<ObjEvent> resets = listener.ofType(ObjEventType.RESET_COLLECTION);
        assertEquals(2, resets.size());
        assertEquals("orders", resets.get(0).collection());
        assertEquals("customers", resets.get(1).collection());
        assertEquals(0, executor.pendingTasks());
    }

    @Test
    void testNonCascadingRelationIsIgnored() {
        open(TestSupport.config(TestSupport.uniqueH2Url()).relation("orders", "customers", false));

        db.delete("customers", 1);

        assertEquals(0, executor.pendingTasks());
    }

    @Test
    void testRunPendingInvalidationsDrainsSynchronously() {
        open(ordersDependOnCustomers());
        db.set("orders", json("{\"id\":1}"));

        db.delete("customers", 1);

        assertEquals(1, db.runPendingInvalidations());
        assertTrue(db.peek("orders", 1).isEmpty());
        executor.runAll();
        assertEquals(1, listener.ofType(ObjEventType.RESET_COLLECTION).size());
    }

    @Test
    void testDefaultExecutorRunsCascadeInBackground() throws Exception {
        RecordingListener background = new RecordingListener();
        db = ClientDb.create(new FakeRemoteDataSource(), ordersDependOnCustomers().build());
        db.init();
        db.addListener(background);
        db.set("orders", json("{\"id\":1}"));

        db.delete("customers", 1);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (background.ofType(ObjEventType.RESET_COLLECTION).isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, background.ofType(ObjEventType.RESET_COLLECTION).size());
        assertTrue(db.peek("orders", 1).isEmpty());
    }
}
