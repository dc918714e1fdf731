package com.tyron.apphost.core.application;

import com.tyron.apphost.core.cache.CacheHelper;
import com.tyron.apphost.core.service.DefaultServiceRegistry;
import com.tyron.apphost.core.test.MockDatabaseContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ApplicationContextCollaboratorsTest {

    @Test
    public void basicContextHasNoDatabaseOrServices() {
        ApplicationContext ctx = new ApplicationContext(new CacheHelper());

        ContextNotSetException db = assertThrows(ContextNotSetException.class, ctx::getDatabaseContext);
        assertEquals("DatabaseContext", db.getCollaborator());
        assertTrue(db.getMessage().contains("DatabaseContext has not been set"));

        ContextNotSetException services = assertThrows(ContextNotSetException.class, ctx::getServices);
        assertEquals("ServiceRegistry", services.getCollaborator());
    }

    @Test
    public void notSetIsAnIllegalStateException() {
        ApplicationContext ctx = new ApplicationContext(new CacheHelper());

        assertThrows(IllegalStateException.class, ctx::getServices);
    }

    @Test
    public void assignedCollaboratorsAreReturned() {
        ApplicationContext ctx = new ApplicationContext(new CacheHelper());
        MockDatabaseContext db = MockDatabaseContext.configured();
        DefaultServiceRegistry services = new DefaultServiceRegistry();

        ctx.setDatabaseContext(db);
        ctx.setServices(services);

        assertSame(db, ctx.getDatabaseContext());
        assertSame(services, ctx.getServices());
    }

    @Test
    public void fullConstructorAssignsEverything() {
        MockDatabaseContext db = MockDatabaseContext.unconfigured();
        DefaultServiceRegistry services = new DefaultServiceRegistry();
        CacheHelper cache = new CacheHelper();

        ApplicationContext ctx = new ApplicationContext(db, services, cache);

        assertSame(db, ctx.getDatabaseContext());
        assertSame(services, ctx.getServices());
        assertSame(cache, ctx.getApplicationCache());
        assertFalse(ctx.isReady());
        assertFalse(ctx.isDisposed());
    }

    @Test
    public void constructorsRejectMissingCollaborators() {
        CacheHelper cache = new CacheHelper();
        MockDatabaseContext db = MockDatabaseContext.configured();
        DefaultServiceRegistry services = new DefaultServiceRegistry();

        IllegalArgumentException e;
        e = assertThrows(IllegalArgumentException.class, () -> new ApplicationContext(null));
        assertEquals("cache == null", e.getMessage());
        e = assertThrows(IllegalArgumentException.class, () -> new ApplicationContext(null, services, cache));
        assertEquals("databaseContext == null", e.getMessage());
        e = assertThrows(IllegalArgumentException.class, () -> new ApplicationContext(db, null, cache));
        assertEquals("services == null", e.getMessage());
        e = assertThrows(IllegalArgumentException.class, () -> new ApplicationContext(db, services, null));
        assertEquals("cache == null", e.getMessage());
    }
}
