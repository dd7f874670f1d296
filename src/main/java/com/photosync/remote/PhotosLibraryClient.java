package com.photosync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.photosync.model.DownloadRequest;
import com.photosync.model.ItemMetadata;
import com.photosync.model.MediaKind;
import com.photosync.model.TimeWindow;
import com.photosync.util.FileUtils;
import com.photosync.util.SyncLogger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

/**
 * {@link RemoteLibraryClient} for the Google Photos Library REST API.
 * <p>
 * Listing uses mediaItems:search with a date filter. The API filters by calendar day, so a
 * window's bounds are widened to whole days in the configured zone; the extra items are
 * absorbed by the idempotent insert on the caller's side.
 * Content base URLs expire, so they are refreshed with mediaItems:batchGet right before downloading.
 */
public class PhotosLibraryClient implements RemoteLibraryClient {

    private static final String CONTEXT = "PhotosLibraryClient";
    private static final int PAGE_SIZE = 75;
    private static final int BATCH_GET_LIMIT = 50;
    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(2);

    private static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "mov", "avi", "mkv", "webm", "m4v", "3gp", "wmv");

    private final String baseUrl;
    private final CredentialProvider credentialProvider;
    private final SyncLogger logger;
    private final ZoneId zone;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public PhotosLibraryClient(String baseUrl, CredentialProvider credentialProvider, SyncLogger logger) {
        this(baseUrl, credentialProvider, logger, ZoneId.systemDefault(),
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(30))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build());
    }

    PhotosLibraryClient(String baseUrl, CredentialProvider credentialProvider, SyncLogger logger,
                        ZoneId zone, HttpClient httpClient) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.credentialProvider = credentialProvider;
        this.logger = logger;
        this.zone = zone;
        this.httpClient = httpClient;
    }

    @Override
    public Iterable<ItemMetadata> listItems(TimeWindow window) {
        return () -> new SearchPageIterator(window);
    }

    @Override
    public ItemMetadata getItem(String id) {
        HttpRequest request = authorizedRequest(baseUrl + "/mediaItems/" + encode(id)).GET().build();
        return toMetadata(sendForJson(request));
    }

    @Override
    public Set<String> batchFetchContent(List<DownloadRequest> requests) {
        List<DownloadRequest> accepted = new ArrayList<>(requests.size());
        for (DownloadRequest dr : requests) {
            if (isConfinedTarget(dr)) {
                accepted.add(dr);
            } else {
                logger.recurringError(CONTEXT, "Refusing to write item with unusable filename '" + dr.getFilename() + "'", null);
            }
        }

        Set<String> written = new HashSet<>();
        for (int from = 0; from < accepted.size(); from += BATCH_GET_LIMIT) {
            List<DownloadRequest> chunk = accepted.subList(from, Math.min(from + BATCH_GET_LIMIT, accepted.size()));
            Map<String, String> contentUrls = refreshContentUrls(chunk);

            for (DownloadRequest dr : chunk) {
                String contentUrl = contentUrls.get(dr.getId());
                if (contentUrl == null) {
                    logger.recurringError(CONTEXT, "No content URL returned for requested item", null);
                    continue;
                }
                if (download(dr, contentUrl)) {
                    written.add(dr.getId());
                }
            }
        }
        return written;
    }

    /**
     * The filename must name a file directly inside the target directory.
     */
    static boolean isConfinedTarget(DownloadRequest dr) {
        String filename = dr.getFilename();
        if (filename == null || filename.isBlank()) {
            return false;
        }
        Path dir = dr.getTargetDirectory().toAbsolutePath().normalize();
        Path target;
        try {
            target = dir.resolve(filename).normalize();
        } catch (InvalidPathException e) {
            return false;
        }
        return dir.equals(target.getParent());
    }

    private Map<String, String> refreshContentUrls(List<DownloadRequest> chunk) {
        StringBuilder url = new StringBuilder(baseUrl).append("/mediaItems:batchGet?");
        for (int i = 0; i < chunk.size(); i++) {
            if (i > 0) url.append('&');
            url.append("mediaItemIds=").append(encode(chunk.get(i).getId()));
        }
        JsonNode response = sendForJson(authorizedRequest(url.toString()).GET().build());

        Map<String, String> urls = new HashMap<>();
        for (JsonNode result : response.path("mediaItemResults")) {
            JsonNode item = result.get("mediaItem");
            if (item != null && item.hasNonNull("baseUrl")) {
                urls.put(item.path("id").asText(), item.get("baseUrl").asText());
            }
        }
        return urls;
    }

    /**
     * Fetches one item's bytes. Failures only affect this item.
     */
    private boolean download(DownloadRequest dr, String contentUrl) {
        String suffix = dr.getMediaKind() == MediaKind.VIDEO ? "=dv" : "=d";
        HttpRequest request = HttpRequest.newBuilder(URI.create(contentUrl + suffix))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = response.body()) {
                if (response.statusCode() != 200) {
                    logger.recurringError(CONTEXT, "Content download failed with HTTP " + response.statusCode(), null);
                    return false;
                }
                FileUtils.writeAtomically(dr.getTargetFile(), body);
            }
            return true;
        } catch (IOException e) {
            logger.recurringError(CONTEXT, "Could not store content", e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpRequest.Builder authorizedRequest(String url) {
        return HttpRequest.newBuilder(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Bearer " + accessToken())
                .header("Accept", "application/json");
    }

    private String accessToken() {
        byte[] blob = credentialProvider.credentials();
        try {
            JsonNode token = mapper.readTree(blob);
            String accessToken = token.path("access_token").asText(null);
            if (accessToken == null || accessToken.isBlank()) {
                throw new AuthorizationException("Stored credentials contain no access_token");
            }
            return accessToken;
        } catch (IOException e) {
            throw new AuthorizationException("Stored credentials are not a JSON token", e);
        }
    }

    private JsonNode sendForJson(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RemoteLibraryException("Request to " + request.uri().getPath() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteLibraryException("Interrupted while waiting for " + request.uri().getPath(), e);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new AuthorizationException("Remote library rejected the credentials (HTTP " + status + ")");
        }
        if (status < 200 || status >= 300) {
            throw new RemoteLibraryException("HTTP " + status + " from " + request.uri().getPath() + ": " + abbreviate(response.body()));
        }
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new RemoteLibraryException("Malformed response from " + request.uri().getPath(), e);
        }
    }

    ObjectNode searchBody(TimeWindow window, String pageToken) {
        ObjectNode body = mapper.createObjectNode();
        body.put("pageSize", PAGE_SIZE);
        if (pageToken != null) {
            body.put("pageToken", pageToken);
        }
        ObjectNode range = mapper.createObjectNode();
        range.set("startDate", dateNode(LocalDate.ofInstant(window.getStart(), zone)));
        range.set("endDate", dateNode(LocalDate.ofInstant(window.getEnd(), zone)));
        ArrayNode ranges = body.putObject("filters").putObject("dateFilter").putArray("ranges");
        ranges.add(range);
        return body;
    }

    private ObjectNode dateNode(LocalDate date) {
        ObjectNode node = mapper.createObjectNode();
        node.put("year", date.getYear());
        node.put("month", date.getMonthValue());
        node.put("day", date.getDayOfMonth());
        return node;
    }

    ItemMetadata toMetadata(JsonNode item) {
        JsonNode mediaMetadata = item.path("mediaMetadata");
        String filename = item.path("filename").asText();
        String mimeType = item.path("mimeType").asText(null);

        MediaKind kind;
        if (mediaMetadata.has("video")) {
            kind = MediaKind.VIDEO;
        } else if (mediaMetadata.has("photo")) {
            kind = MediaKind.PHOTO;
        } else if (VIDEO_EXTENSIONS.contains(FileUtils.getExtension(filename))
                || (mimeType != null && mimeType.startsWith("video/"))) {
            kind = MediaKind.VIDEO;
        } else {
            kind = MediaKind.PHOTO;
        }

        return new ItemMetadata(
                item.path("id").asText(),
                mediaMetadata.path("creationTime").asText(),
                filename,
                mimeType,
                kind,
                item.path("baseUrl").asText(null));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    /**
     * Pulls search result pages on demand. The service returns newest items first.
     */
    private class SearchPageIterator implements Iterator<ItemMetadata> {
        private final TimeWindow window;
        private final Deque<ItemMetadata> page = new ArrayDeque<>();
        private String pageToken;
        private boolean lastPage;

        SearchPageIterator(TimeWindow window) {
            this.window = window;
        }

        @Override
        public boolean hasNext() {
            while (page.isEmpty() && !lastPage) {
                fetchPage();
            }
            return !page.isEmpty();
        }

        @Override
        public ItemMetadata next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.poll();
        }

        private void fetchPage() {
            String body = searchBody(window, pageToken).toString();
            HttpRequest request = authorizedRequest(baseUrl + "/mediaItems:search")
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();
            JsonNode response = sendForJson(request);

            for (JsonNode item : response.path("mediaItems")) {
                page.add(toMetadata(item));
            }
            pageToken = response.path("nextPageToken").asText(null);
            lastPage = pageToken == null || pageToken.isEmpty();
        }
    }
}
