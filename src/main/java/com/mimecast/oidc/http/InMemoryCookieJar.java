package com.mimecast.oidc.http;

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Cookie jar kept for the lifetime of a handler.
 *
 * <p>Cookies are shared by every request going through the same client.
 */
public class InMemoryCookieJar implements CookieJar {

    private final List<Cookie> cookies = new ArrayList<>();

    @Override
    public synchronized void saveFromResponse(@NotNull HttpUrl url, @NotNull List<Cookie> received) {
        for (Cookie cookie : received) {
            cookies.removeIf(existing -> existing.name().equals(cookie.name()) &&
                    existing.domain().equals(cookie.domain()) &&
                    existing.path().equals(cookie.path()));
            cookies.add(cookie);
        }
    }

    @NotNull
    @Override
    public synchronized List<Cookie> loadForRequest(@NotNull HttpUrl url) {
        List<Cookie> matching = new ArrayList<>();
        long now = System.currentTimeMillis();
        for (Iterator<Cookie> iterator = cookies.iterator(); iterator.hasNext(); ) {
            Cookie cookie = iterator.next();
            if (cookie.expiresAt() < now) {
                iterator.remove();
            } else if (cookie.matches(url)) {
                matching.add(cookie);
            }
        }
        return matching;
    }
}
