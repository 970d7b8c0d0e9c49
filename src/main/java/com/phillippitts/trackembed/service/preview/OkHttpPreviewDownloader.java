package com.phillippitts.trackembed.service.preview;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link PreviewDownloader} on OkHttp.
 *
 * <p>The body is streamed into a temporary sibling file and moved into place only once it was
 * fully written, so an interrupted download never looks like a finished one.
 */
public class OkHttpPreviewDownloader implements PreviewDownloader {

    private final OkHttpClient client;

    /**
     * @param baseClient shared client; a derived client with the download timeout is used
     * @param timeout whole-call timeout for one download
     */
    public OkHttpPreviewDownloader(OkHttpClient baseClient, Duration timeout) {
        Objects.requireNonNull(baseClient, "baseClient");
        Objects.requireNonNull(timeout, "timeout");
        this.client = baseClient.newBuilder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    @Override
    public void download(String url, Path target) throws IOException {
        HttpUrl httpUrl = url == null ? null : HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new IOException("Invalid preview URL");
        }
        Request request = new Request.Builder().url(httpUrl).get().build();
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".part");
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " for preview");
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty preview response");
            }
            try (InputStream in = body.byteStream()) {
                Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
