package com.example.renderflow.service;

import com.example.renderflow.dto.plan.AudioTrack;
import com.example.renderflow.dto.plan.ExecutionPlan;
import com.example.renderflow.dto.plan.RenderInput;
import com.example.renderflow.dto.plan.TimelineSegment;
import com.example.renderflow.exception.AssetDownloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves remote assets to files in a local cache directory shared by all jobs. The cache file
 * name is derived from the URL, so an asset already on disk is reused without a request.
 */
public class AssetFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(AssetFetcher.class);
    private static final int ERROR_BODY_MAX = 512;
    private static final int COPY_BUFFER = 64 * 1024;

    private final Path cacheDir;
    private final int httpTimeoutMs;
    private final String userAgent;
    private final int maxRedirects;

    public AssetFetcher(Path cacheDir, int httpTimeoutSeconds, String userAgent, int maxRedirects) {
        this.cacheDir = cacheDir.toAbsolutePath().normalize();
        this.httpTimeoutMs = Math.max(1, httpTimeoutSeconds) * 1000;
        this.userAgent = userAgent;
        this.maxRedirects = maxRedirects;
        try {
            Files.createDirectories(this.cacheDir);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to create asset cache directory: " + this.cacheDir, e);
        }
    }

    /** Every distinct asset URL a job refers to, in first-seen order. */
    public static Set<String> collectUrls(RenderInput input, ExecutionPlan plan) {
        Set<String> urls = new LinkedHashSet<>();
        if (input != null && notBlank(input.sourceVideoUrl())) {
            urls.add(input.sourceVideoUrl());
        }
        if (plan != null) {
            if (plan.timeline() != null) {
                for (TimelineSegment segment : plan.timeline()) {
                    if (segment != null && notBlank(segment.assetUrl())) urls.add(segment.assetUrl());
                }
            }
            for (AudioTrack track : plan.audioTracksOrEmpty()) {
                if (track != null && notBlank(track.assetUrl())) urls.add(track.assetUrl());
            }
        }
        return urls;
    }

    public Map<String, Path> resolve(Collection<String> urls) {
        return resolve(urls, null);
    }

    /**
     * Downloads whatever is not cached yet. Either every URL resolves or the call fails.
     *
     * @param budget time allowed for all downloads together, {@code null} for no limit
     * @return url to local file, in iteration order of {@code urls}
     * @throws AssetDownloadException on the first URL that cannot be fetched, or once the budget is spent
     */
    public Map<String, Path> resolve(Collection<String> urls, Duration budget) {
        Long deadlineNanos = budget == null ? null : System.nanoTime() + budget.toNanos();
        Map<String, Path> resolved = new LinkedHashMap<>();
        for (String url : urls) {
            if (!notBlank(url) || resolved.containsKey(url)) {
                continue;
            }
            Path target = cacheFileFor(url);
            if (Files.exists(target)) {
                LOGGER.debug("Asset cache hit url={} path={}", url, target);
            } else {
                LOGGER.info("Downloading asset url={} target={}", url, target);
                try {
                    download(url, target, deadlineNanos);
                } catch (AssetDownloadException e) {
                    throw e;
                } catch (Exception e) {
                    throw new AssetDownloadException(url, "Download failed for " + url + ": " + e.getMessage(), e);
                }
                if (!Files.exists(target)) {
                    throw new AssetDownloadException(url, "Download reported success but target is missing: " + target, null);
                }
            }
            resolved.put(url, target);
        }
        return resolved;
    }

    /** MD5 of the URL plus the extension of its path, e.g. {@code 0cc1...e4.mp4}. */
    public Path cacheFileFor(String url) {
        return cacheDir.resolve(md5Hex(url) + extensionOf(url));
    }

    protected void download(String url, Path target, Long deadlineNanos) throws IOException {
        String current = url;
        int redirects = 0;

        while (redirects <= maxRedirects) {
            int timeoutMs = timeoutMs(url, deadlineNanos);
            URI uri = URI.create(current);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new AssetDownloadException(url, "Unsupported asset URL scheme: " + current, null);
            }
            HttpURLConnection conn = (HttpURLConnection) uri.toURL().openConnection();
            conn.setInstanceFollowRedirects(false);
            conn.setConnectTimeout(timeoutMs);
            conn.setReadTimeout(timeoutMs);
            conn.setRequestProperty("User-Agent", userAgent);
            conn.setRequestProperty("Accept", "*/*");

            int status = conn.getResponseCode();
            if (isRedirect(status)) {
                String loc = conn.getHeaderField("Location");
                conn.disconnect();
                if (loc == null || loc.isBlank()) {
                    throw new AssetDownloadException(url, "Redirect without Location header from: " + current, null);
                }
                current = uri.resolve(loc).toString();
                redirects++;
                continue;
            }

            if (status >= 200 && status < 300) {
                // unique part file: concurrent workers may fetch the same asset
                Path tmp = target.resolveSibling(target.getFileName() + "." + ProcessHandle.current().pid()
                        + "." + Thread.currentThread().getId() + ".part");
                try (InputStream is = conn.getInputStream()) {
                    try (OutputStream os = Files.newOutputStream(tmp)) {
                        byte[] buf = new byte[COPY_BUFFER];
                        int n;
                        while ((n = is.read(buf)) != -1) {
                            os.write(buf, 0, n);
                            timeoutMs(url, deadlineNanos);
                        }
                    }
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } finally {
                    conn.disconnect();
                    Files.deleteIfExists(tmp);
                }
                return;
            }

            String body;
            try (InputStream es = conn.getErrorStream()) {
                body = es != null ? new String(es.readNBytes(ERROR_BODY_MAX), StandardCharsets.UTF_8) : "<no body>";
            } finally {
                conn.disconnect();
            }
            throw new AssetDownloadException(url, "HTTP download failed " + status + " for " + current + " body=" + body, null);
        }

        throw new AssetDownloadException(url, "Too many redirects (" + maxRedirects + ") for " + url, null);
    }

    /** Per-request timeout, never past the deadline; throws once the deadline has passed. */
    private int timeoutMs(String url, Long deadlineNanos) {
        if (deadlineNanos == null) {
            return httpTimeoutMs;
        }
        long remainingMs = (deadlineNanos - System.nanoTime()) / 1_000_000;
        if (remainingMs <= 0) {
            throw new AssetDownloadException(url, "Download deadline exceeded for " + url, null);
        }
        return (int) Math.min(httpTimeoutMs, remainingMs);
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    static String extensionOf(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            path = url.split("[?#]", 2)[0];
        }
        if (path == null) {
            return "";
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        String ext = name.substring(dot).toLowerCase(Locale.ROOT);
        return ext.matches("\\.[a-z0-9]{1,8}") ? ext : "";
    }

    private static String md5Hex(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
