package com.tyron.apphost.core.application;

import com.tyron.apphost.core.cache.CacheHelper;
import com.tyron.apphost.core.config.ApplicationSettings;
import com.tyron.apphost.core.test.RecordingGlobalStateReset;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ServerEnvironmentTest {

    private static ApplicationContext newContext(ApplicationSettings settings) {
        return new ApplicationContext(new CacheHelper(), ApplicationContextOptions.builder()
                .settings(settings)
                .globalStateReset(new RecordingGlobalStateReset())
                .build());
    }

    @Test
    public void routingUrlWinsAndLosesTrailingSlash() {
        ApplicationSettings settings = ApplicationSettings.builder()
                .applicationUrl("https://cms.example.org/backoffice/")
                .scheduledTasksBaseUrl("ignored.example.org")
                .build();

        assertEquals("https://cms.example.org/backoffice", newContext(settings).getApplicationUrl());
    }

    @Test
    public void scheduledTasksBaseUrlUsesHttpByDefault() {
        ApplicationSettings settings = ApplicationSettings.builder()
                .scheduledTasksBaseUrl("cms.example.org:8080/")
                .build();

        assertEquals("http://cms.example.org:8080/backoffice", newContext(settings).getApplicationUrl());
    }

    @Test
    public void scheduledTasksBaseUrlUsesHttpsWhenSslIsRequired() {
        ApplicationSettings settings = ApplicationSettings.builder()
                .scheduledTasksBaseUrl("cms.example.org")
                .useSsl(true)
                .backofficePath("admin/")
                .build();

        assertEquals("https://cms.example.org/admin", newContext(settings).getApplicationUrl());
    }

    @Test
    public void noSettingsLeaveUrlUnresolved() {
        ApplicationContext ctx = newContext(ApplicationSettings.empty());

        assertFalse(ServerEnvironment.INSTANCE.trySetApplicationUrlFromSettings(ctx, ApplicationSettings.empty()));
        assertNull(ctx.getApplicationUrl());
    }

    @Test
    public void firstRequestFillsInMissingUrl() {
        ApplicationContext ctx = newContext(ApplicationSettings.empty());

        String url = ServerEnvironment.ensureApplicationUrl(ctx, URI.create("https://www.example.org:8443/some/page?x=1"));

        assertEquals("https://www.example.org:8443/backoffice", url);
        assertEquals(url, ctx.getApplicationUrl());

        // Later requests from another host do not change it.
        ServerEnvironment.ensureApplicationUrl(ctx, URI.create("http://other.example.org/"));
        assertEquals(url, ctx.getApplicationUrl());
    }

    @Test
    public void settingsTakePrecedenceOverRequest() {
        ApplicationContext ctx = newContext(ApplicationSettings.builder()
                .applicationUrl("https://configured.example.org/backoffice")
                .build());

        String url = ServerEnvironment.ensureApplicationUrl(ctx, URI.create("http://request.example.org/"));

        assertEquals("https://configured.example.org/backoffice", url);
    }

    @Test
    public void relativeRequestIsRejected() {
        ApplicationContext ctx = newContext(ApplicationSettings.empty());

        assertThrows(IllegalArgumentException.class, () -> ServerEnvironment.ensureApplicationUrl(ctx, URI.create("/page")));
    }

    @Test
    public void resolvedUrlIsCachedOnTheContext() {
        AtomicInteger calls = new AtomicInteger();
        ApplicationContext ctx = new ApplicationContext(new CacheHelper(), ApplicationContextOptions.builder()
                .urlResolver((context, settings) -> {
                    calls.incrementAndGet();
                    context.setApplicationUrl("http://resolved.example.org/backoffice");
                    return true;
                })
                .globalStateReset(new RecordingGlobalStateReset())
                .build());

        assertEquals("http://resolved.example.org/backoffice", ctx.getApplicationUrl());
        assertEquals("http://resolved.example.org/backoffice", ctx.getApplicationUrl());
        assertEquals(1, calls.get());
    }

    @Test
    public void unresolvedUrlIsRetriedOnEveryAccess() {
        AtomicInteger calls = new AtomicInteger();
        ApplicationContext ctx = new ApplicationContext(new CacheHelper(), ApplicationContextOptions.builder()
                .urlResolver((context, settings) -> {
                    calls.incrementAndGet();
                    return false;
                })
                .globalStateReset(new RecordingGlobalStateReset())
                .build());

        assertNull(ctx.getApplicationUrl());
        assertNull(ctx.getApplicationUrl());
        assertEquals(2, calls.get());
    }

    @Test
    public void trimsEveryTrailingSlash() {
        assertEquals("http://a", ServerEnvironment.trimTrailingSlashes("http://a///"));
        assertEquals("", ServerEnvironment.trimTrailingSlashes("/"));
    }
}
