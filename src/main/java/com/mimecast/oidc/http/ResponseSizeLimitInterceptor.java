package com.mimecast.oidc.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import okio.BufferedSource;
import okio.ForwardingSource;
import okio.Okio;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Caps the number of response body bytes a client will read.
 *
 * <p>Responses declaring a larger Content-Length are rejected up front.
 * <br>Other responses fail once more than the cap has been read.
 */
public class ResponseSizeLimitInterceptor implements Interceptor {

    private final long maxBytes;

    /**
     * Constructs a new ResponseSizeLimitInterceptor instance.
     *
     * @param maxBytes Maximum body size in bytes.
     */
    public ResponseSizeLimitInterceptor(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    @NotNull
    @Override
    public Response intercept(@NotNull Chain chain) throws IOException {
        Response response = chain.proceed(chain.request());
        ResponseBody body = response.body();
        if (body == null) {
            return response;
        }

        if (body.contentLength() > maxBytes) {
            long declared = body.contentLength();
            response.close();
            throw new ResponseTooLargeException(declared, maxBytes);
        }

        return response.newBuilder()
                .body(new LimitedResponseBody(body, maxBytes))
                .build();
    }

    /**
     * Response body failing past the cap.
     */
    private static class LimitedResponseBody extends ResponseBody {
        private final ResponseBody delegate;
        private final BufferedSource source;

        LimitedResponseBody(ResponseBody delegate, long maxBytes) {
            this.delegate = delegate;
            this.source = Okio.buffer(new ForwardingSource(delegate.source()) {
                private long total;

                @Override
                public long read(@NotNull Buffer sink, long byteCount) throws IOException {
                    long read = super.read(sink, byteCount);
                    if (read > 0) {
                        total += read;
                        if (total > maxBytes) {
                            throw new ResponseTooLargeException(total, maxBytes);
                        }
                    }
                    return read;
                }
            });
        }

        @Nullable
        @Override
        public MediaType contentType() {
            return delegate.contentType();
        }

        @Override
        public long contentLength() {
            return delegate.contentLength();
        }

        @NotNull
        @Override
        public BufferedSource source() {
            return source;
        }
    }
}
