package com.gene.evidence.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gene.evidence.metrics.NoOpPipelineMetrics;
import com.gene.evidence.metrics.PipelineMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link GeneAnnotationClient} over NCBI E-utilities and the UniProt REST API.
 *
 * <p>Responses are cached by URL for the lifetime of the client so a candidate list with
 * repeated identifiers does not hit the network twice. Each request goes through the
 * {@link RetryPolicy}.</p>
 *
 * <pre>
 * GeneAnnotationClient client = HttpGeneAnnotationClient.builder()
 *     .timeout(Duration.ofSeconds(15))
 *     .retryPolicy(new RetryPolicy(3, Duration.ofSeconds(1)))
 *     .build();
 * </pre>
 */
public class HttpGeneAnnotationClient implements GeneAnnotationClient {
    private static final Logger log = LoggerFactory.getLogger(HttpGeneAnnotationClient.class);

    private static final String DEFAULT_NCBI_BASE_URL = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
    private static final String DEFAULT_UNIPROT_BASE_URL = "https://rest.uniprot.org/uniprotkb";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);
    private static final long DEFAULT_CACHE_SIZE = 1000;
    static final String CRANIOFACIAL_TERM = "+AND+(craniofacial+OR+neural+crest)";

    private final String ncbiBaseUrl;
    private final String uniprotBaseUrl;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Cache<String, JsonNode> responses;
    private final PipelineMetrics metrics;

    private HttpGeneAnnotationClient(Builder builder) {
        this.ncbiBaseUrl = stripSlash(builder.ncbiBaseUrl != null ? builder.ncbiBaseUrl : DEFAULT_NCBI_BASE_URL);
        this.uniprotBaseUrl = stripSlash(builder.uniprotBaseUrl != null ? builder.uniprotBaseUrl : DEFAULT_UNIPROT_BASE_URL);
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new RetryPolicy(3, Duration.ofSeconds(1));
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = new ObjectMapper();
        this.responses = Caffeine.newBuilder()
                .maximumSize(builder.cacheMaxSize > 0 ? builder.cacheMaxSize : DEFAULT_CACHE_SIZE)
                .recordStats()
                .build();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpPipelineMetrics();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String geneSummary(String ncbiId) {
        if (isBlank(ncbiId)) {
            return "";
        }
        String id = ncbiId.trim();
        String url = ncbiBaseUrl + "/esummary.fcgi?db=gene&id=" + encode(id) + "&retmode=json";
        JsonNode root = fetchJson(SERVICE_NCBI_GENE, url);
        return root.path("result").path(id).path("summary").asText("");
    }

    @Override
    public int craniofacialPublicationCount(String symbol) {
        if (isBlank(symbol)) {
            return 0;
        }
        String url = ncbiBaseUrl + "/esearch.fcgi?db=pubmed&term=" + encode(symbol.trim()) + CRANIOFACIAL_TERM
                + "&retmode=json&retmax=0";
        JsonNode root = fetchJson(SERVICE_PUBMED, url);
        return root.path("esearchresult").path("count").asInt(0);
    }

    @Override
    public String proteinFunction(String uniprotId) {
        if (isBlank(uniprotId)) {
            return "";
        }
        String url = uniprotBaseUrl + "/" + encode(uniprotId.trim()) + ".json";
        JsonNode root = fetchJson(SERVICE_UNIPROT, url);
        for (JsonNode comment : root.path("comments")) {
            if ("FUNCTION".equals(comment.path("commentType").asText())) {
                JsonNode texts = comment.path("texts");
                if (texts.isArray() && !texts.isEmpty()) {
                    return texts.get(0).path("value").asText("");
                }
            }
        }
        return "";
    }

    /**
     * Number of cached responses.
     */
    public long cachedResponses() {
        return responses.estimatedSize();
    }

    private JsonNode fetchJson(String service, String url) {
        JsonNode cached = responses.getIfPresent(url);
        if (cached != null) {
            metrics.recordUpstreamCacheHit();
            return cached;
        }
        metrics.recordUpstreamCacheMiss();
        JsonNode body = retryPolicy.execute(service, () -> send(url));
        responses.put(url, body);
        return body;
    }

    private JsonNode send(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        log.debug("upstream.request url={}", url);
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + " from " + url);
        }
        return objectMapper.readTree(response.body());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static class Builder {
        private String ncbiBaseUrl;
        private String uniprotBaseUrl;
        private Duration timeout;
        private RetryPolicy retryPolicy;
        private HttpClient httpClient;
        private long cacheMaxSize;
        private PipelineMetrics metrics;

        public Builder ncbiBaseUrl(String ncbiBaseUrl) {
            this.ncbiBaseUrl = ncbiBaseUrl;
            return this;
        }

        public Builder uniprotBaseUrl(String uniprotBaseUrl) {
            this.uniprotBaseUrl = uniprotBaseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder cacheMaxSize(long cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public HttpGeneAnnotationClient build() {
            return new HttpGeneAnnotationClient(this);
        }
    }
}
