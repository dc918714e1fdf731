package com.tyron.apphost.core.application;

import com.tyron.apphost.core.config.ApplicationSettings;

import java.net.URI;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Works out the application url from settings or from the first request the server sees.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>{@code web.routing.applicationUrl}, used as is</li>
 *   <li>{@code scheduledTasks.baseUrl}, prefixed with {@code https://} when {@code security.useSsl}
 *   is set (otherwise {@code http://}) and suffixed with the backoffice path</li>
 *   <li>the scheme and authority of the first request, suffixed with the backoffice path</li>
 * </ol>
 * Trailing slashes are trimmed in every case.
 */
public final class ServerEnvironment implements ApplicationUrlResolver {

    private static final Logger LOG = Logger.getLogger(ServerEnvironment.class.getName());

    public static final ServerEnvironment INSTANCE = new ServerEnvironment();

    private ServerEnvironment() {
    }

    @Override
    public boolean trySetApplicationUrlFromSettings(ApplicationContext context, ApplicationSettings settings) {
        if (context == null) throw new IllegalArgumentException("context == null");
        if (settings == null) return false;

        String url = settings.getApplicationUrl();
        if (url != null && !url.isBlank()) {
            context.setApplicationUrl(trimTrailingSlashes(url.trim()));
            logAssigned(context, "web.routing.applicationUrl");
            return true;
        }

        String baseUrl = settings.getScheduledTasksBaseUrl();
        if (baseUrl != null && !baseUrl.isBlank()) {
            String scheme = settings.isUseSsl() ? "https://" : "http://";
            url = scheme + trimTrailingSlashes(baseUrl.trim()) + settings.getBackofficePath();
            context.setApplicationUrl(trimTrailingSlashes(url));
            logAssigned(context, "scheduledTasks.baseUrl");
            return true;
        }

        return false;
    }

    /**
     * Falls back to the url of an inbound request when nothing else has set the application url yet.
     *
     * @return the application url after the call.
     */
    public static String ensureApplicationUrl(ApplicationContext context, URI request) {
        if (context == null) throw new IllegalArgumentException("context == null");
        if (request == null) throw new IllegalArgumentException("request == null");

        String existing = context.getApplicationUrl();
        if (existing != null) {
            return existing;
        }
        if (request.getScheme() == null || request.getRawAuthority() == null) {
            throw new IllegalArgumentException("request must be an absolute url: " + request);
        }

        ApplicationSettings settings = context.currentSettings();
        String url = request.getScheme() + "://" + request.getRawAuthority() + settings.getBackofficePath();
        context.setApplicationUrl(trimTrailingSlashes(url));
        logAssigned(context, "request");
        return context.getApplicationUrl();
    }

    static String trimTrailingSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end);
    }

    private static void logAssigned(ApplicationContext context, String source) {
        if (LOG.isLoggable(Level.INFO)) {
            LOG.info("ApplicationUrl: " + context.getApplicationUrl() + " (using " + source + ")");
        }
    }
}
