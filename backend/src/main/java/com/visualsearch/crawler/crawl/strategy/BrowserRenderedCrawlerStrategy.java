package com.visualsearch.crawler.crawl.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.visualsearch.crawler.crawl.extract.PriceParser;
import com.visualsearch.crawler.crawl.extract.ProductDeduplicator;
import com.visualsearch.crawler.crawl.extract.ProductExtractor;
import com.visualsearch.crawler.crawl.model.CrawlPageResult;
import com.visualsearch.crawler.crawl.model.CrawlerConfig;
import com.visualsearch.crawler.crawl.model.CrawlerType;
import com.visualsearch.crawler.crawl.model.ProductCandidate;
import com.visualsearch.crawler.crawl.model.SitemapDiscoveryResult;
import com.visualsearch.crawler.crawl.model.UrlDiscoveryResult;
import com.visualsearch.crawler.crawl.render.PageRenderer;
import com.visualsearch.crawler.crawl.render.RenderRequest;
import com.visualsearch.crawler.crawl.render.RenderedPage;
import com.visualsearch.crawler.crawl.robots.RobotsTxtService;
import com.visualsearch.crawler.crawl.sitemap.SitemapService;
import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;
import com.visualsearch.crawler.crawl.util.HashUtils;
import com.visualsearch.crawler.crawl.util.UrlPatternFilter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * For script-heavy or bot-protected storefronts: pages are rendered in a browser, product data
 * is read from the embedded page state, then from the DOM. Strategy specific knobs live in
 * {@link CrawlerConfig#getCustomSettings()}.
 */
@Component
public class BrowserRenderedCrawlerStrategy implements CrawlerStrategy {
    public static final String SETTING_SITEMAP_URL = "SitemapUrl";
    public static final String SETTING_MAX_PAGES = "MaxPages";
    public static final String SETTING_PRODUCT_URL_PATTERN = "ProductUrlPattern";
    public static final String SETTING_PRODUCT_DETAIL_SELECTOR = "ProductDetailSelector";
    public static final String SETTING_PAGE_STATE_VARIABLE = "PageStateVariable";
    public static final String SETTING_PRICE_IN_CENTS = "PriceInCents";
    public static final String SETTING_CURRENCY = "Currency";

    static final String DEFAULT_PRODUCT_URL_PATTERN = "-l(\\d+)";
    static final String DEFAULT_PRODUCT_DETAIL_SELECTOR = "[data-qa-qualifier='product-detail-info']";
    static final String DEFAULT_PAGE_STATE_VARIABLE = "__PRELOADED_STATE__";
    static final String DEFAULT_PAGINATION_SELECTOR = "a[data-qa-qualifier='pagination-next']";
    static final String DEFAULT_NAME_SELECTOR = "h1.product-detail-info__header-name";
    static final String DEFAULT_PRICE_SELECTOR = "[data-qa-qualifier='product-detail-info-price-amount']";
    static final String DEFAULT_DESCRIPTION_SELECTOR = ".expandable-text__inner-content";
    static final String DEFAULT_IMAGE_SELECTOR = "picture.media-image img";
    static final String TIMEOUT_ERROR = "Page load timeout - possible bot detection";

    private static final Logger log = LoggerFactory.getLogger(BrowserRenderedCrawlerStrategy.class);
    private static final String[] IMAGE_ATTRIBUTES = {"src", "data-src", "data-lazy-src"};

    private final PageRenderer pageRenderer;
    private final SitemapService sitemapService;
    private final RobotsTxtService robotsTxtService;
    private final ProductExtractor productExtractor;
    private final ObjectMapper objectMapper;

    public BrowserRenderedCrawlerStrategy(
        PageRenderer pageRenderer,
        SitemapService sitemapService,
        RobotsTxtService robotsTxtService,
        ProductExtractor productExtractor,
        ObjectMapper objectMapper
    ) {
        this.pageRenderer = pageRenderer;
        this.sitemapService = sitemapService;
        this.robotsTxtService = robotsTxtService;
        this.productExtractor = productExtractor;
        this.objectMapper = objectMapper;
    }

    @Override
    public CrawlerType type() {
        return CrawlerType.BROWSER_RENDERED;
    }

    @Override
    public UrlDiscoveryResult discoverUrls(String startUrl, String sitemapUrl, CrawlerConfig config, int maxPages)
        throws DiscoveryException {
        if (!CrawlUrlUtils.isHttpUrl(startUrl)) {
            throw new DiscoveryException("Start URL is not a valid http(s) URL: " + startUrl);
        }
        String sitemap = sitemapUrl;
        if (sitemap == null || sitemap.isBlank()) {
            sitemap = config.customSetting(SETTING_SITEMAP_URL, CrawlUrlUtils.siteRoot(startUrl) + "/sitemap.xml");
        }
        int limit = Math.min(maxPages, config.customIntSetting(SETTING_MAX_PAGES, maxPages));

        SitemapDiscoveryResult result = sitemapService.resolve(List.of(sitemap), config.getUserAgent());
        Pattern productPattern = productUrlPattern(config);
        List<String> productUrls = new ArrayList<>();
        for (String url : result.urls()) {
            if (productPattern.matcher(url).find()) {
                productUrls.add(url);
            }
        }
        UrlPatternFilter filter = UrlPatternFilter.of(config.getIncludePatterns(), config.getExcludePatterns());
        List<String> urls = GenericCrawlerStrategy.capDistinct(filter.apply(productUrls), limit);
        if (urls.isEmpty()) {
            log.warn("No product urls in sitemap {} (errors={}), starting from {}", sitemap, result.errors(), startUrl);
            return new UrlDiscoveryResult(List.of(startUrl.trim()), "start_url", true);
        }
        log.info("Discovered {} product urls from {}", urls.size(), sitemap);
        return new UrlDiscoveryResult(urls, sitemap, true);
    }

    @Override
    public CrawlPageResult fetchAndExtract(String url, CrawlerConfig config) throws InterruptedException {
        long delay = randomDelayMs(config.getRequestDelayMs(), ThreadLocalRandom.current());
        if (delay > 0) {
            Thread.sleep(delay);
        }
        if (config.isRespectRobotsTxt() && !robotsTxtService.isAllowed(url, config.getUserAgent())) {
            return CrawlPageResult.failure(url, null, "blocked_by_robots");
        }

        RenderedPage page = pageRenderer.render(new RenderRequest(
            url,
            config.getUserAgent(),
            config.customSetting(SETTING_PRODUCT_DETAIL_SELECTOR, DEFAULT_PRODUCT_DETAIL_SELECTOR),
            config.customSetting(SETTING_PAGE_STATE_VARIABLE, DEFAULT_PAGE_STATE_VARIABLE)
        ));
        if (RenderedPage.ERROR_TIMEOUT.equals(page.errorCode())) {
            return CrawlPageResult.failure(url, null, TIMEOUT_ERROR);
        }
        if (!page.isSuccessful()) {
            String reason = page.errorMessage() == null || page.errorMessage().isBlank() ? "" : ": " + page.errorMessage();
            String error = page.statusCode() > 0 ? "HTTP " + page.statusCode() + reason : page.errorCode() + reason;
            return CrawlPageResult.failure(url, page.statusCode() > 0 ? page.statusCode() : null, error);
        }

        String html = page.html() == null ? "" : page.html();
        String baseUrl = page.finalUrl() == null ? url : page.finalUrl();
        Document document = Jsoup.parse(html, baseUrl);
        List<ProductCandidate> products = new ArrayList<>();
        readPageState(page.pageStateJson(), url, config).ifPresent(products::add);
        if (products.isEmpty()) {
            readDom(document, url, config).ifPresent(products::add);
        }
        List<ProductCandidate> unique = new ArrayList<>();
        for (ProductCandidate candidate : ProductDeduplicator.dedupe(products, url)) {
            unique.add(candidate.productUrl() == null ? candidate.withProductUrl(url) : candidate);
        }
        String paginationSelector = config.getPaginationSelector() == null || config.getPaginationSelector().isBlank()
            ? DEFAULT_PAGINATION_SELECTOR
            : config.getPaginationSelector();
        return new CrawlPageResult(
            url,
            true,
            page.statusCode(),
            "text/html",
            page.title(),
            HashUtils.contentHash(html),
            unique,
            productExtractor.extractPaginationLinks(document, baseUrl, paginationSelector),
            null
        );
    }

    /**
     * Uniform in {@code [configured, 3 x configured]}.
     */
    static long randomDelayMs(int configuredMs, Random random) {
        if (configuredMs <= 0) {
            return 0;
        }
        return configuredMs + (long) (random.nextDouble() * (2L * configuredMs + 1));
    }

    Optional<ProductCandidate> readPageState(String json, String url, CrawlerConfig config) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable page state on {}: {}", url, e.getOriginalMessage());
            return Optional.empty();
        }
        JsonNode product = root.path("product");
        if (!product.isObject()) {
            product = root.path("productDetail");
        }
        if (!product.isObject()) {
            return Optional.empty();
        }
        String name = text(product, "name");
        String id = firstNonBlank(text(product, "id"), idFromUrl(url, config));
        if (name == null || id == null) {
            return Optional.empty();
        }
        BigDecimal price = statePrice(product, config);
        return Optional.of(new ProductCandidate(
            id,
            name,
            text(product, "description"),
            price,
            price == null ? null : currency(config),
            null,
            firstNonBlank(text(product, "category"), text(product, "familyName")),
            stateImages(product, url),
            product.toString()
        ));
    }

    private Optional<ProductCandidate> readDom(Document document, String url, CrawlerConfig config) {
        String name = selectText(document, orDefault(config.getProductNameSelector(), DEFAULT_NAME_SELECTOR));
        if (name == null) {
            return Optional.empty();
        }
        String priceText = selectText(document, orDefault(config.getProductPriceSelector(), DEFAULT_PRICE_SELECTOR));
        BigDecimal price = PriceParser.parse(priceText);
        String description = selectText(document, orDefault(config.getProductDescriptionSelector(), DEFAULT_DESCRIPTION_SELECTOR));
        List<String> images = new ArrayList<>();
        for (Element image : safeSelect(document, orDefault(config.getProductImageSelector(), DEFAULT_IMAGE_SELECTOR))) {
            for (String attribute : IMAGE_ATTRIBUTES) {
                String resolved = CrawlUrlUtils.resolve(url, image.attr(attribute));
                if (resolved != null) {
                    if (!images.contains(resolved)) {
                        images.add(resolved);
                    }
                    break;
                }
            }
        }
        ObjectNode raw = objectMapper.createObjectNode();
        raw.put("source", "dom");
        raw.put("name", name);
        raw.put("price", priceText);
        raw.put("description", description);
        images.forEach(raw.putArray("images")::add);
        return Optional.of(new ProductCandidate(
            idFromUrl(url, config),
            name,
            description,
            price,
            price == null ? null : currency(config),
            null,
            null,
            images,
            raw.toString()
        ));
    }

    private BigDecimal statePrice(JsonNode product, CrawlerConfig config) {
        JsonNode priceNode = product.get("price");
        if (priceNode == null || priceNode.isNull()) {
            priceNode = product.get("currentPrice");
        }
        if (priceNode == null || priceNode.isNull()) {
            return null;
        }
        boolean inCents = Boolean.parseBoolean(config.customSetting(SETTING_PRICE_IN_CENTS, "true"));
        if (priceNode.isNumber()) {
            BigDecimal value = priceNode.decimalValue();
            return inCents ? value.divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP) : value;
        }
        return PriceParser.parse(priceNode.asText());
    }

    private List<String> stateImages(JsonNode product, String url) {
        JsonNode media = product.get("images");
        if (media == null || !media.isArray()) {
            media = product.get("media");
        }
        List<String> images = new ArrayList<>();
        if (media == null || !media.isArray()) {
            return images;
        }
        for (JsonNode item : media) {
            String raw = item.isTextual() ? item.asText() : firstNonBlank(text(item, "url"), text(item, "src"));
            String resolved = CrawlUrlUtils.resolve(url, raw);
            if (resolved != null && !images.contains(resolved)) {
                images.add(resolved);
            }
        }
        return images;
    }

    private String idFromUrl(String url, CrawlerConfig config) {
        Matcher matcher = productUrlPattern(config).matcher(url);
        if (!matcher.find()) {
            return null;
        }
        return matcher.groupCount() >= 1 && matcher.group(1) != null ? matcher.group(1) : matcher.group();
    }

    private Pattern productUrlPattern(CrawlerConfig config) {
        String pattern = config.customSetting(SETTING_PRODUCT_URL_PATTERN, DEFAULT_PRODUCT_URL_PATTERN);
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid product url pattern '{}', using default", pattern);
            return Pattern.compile(DEFAULT_PRODUCT_URL_PATTERN, Pattern.CASE_INSENSITIVE);
        }
    }

    private String currency(CrawlerConfig config) {
        return config.customSetting(SETTING_CURRENCY, ProductExtractor.DEFAULT_CURRENCY);
    }

    private String selectText(Document document, String selector) {
        List<Element> matches = safeSelect(document, selector);
        if (matches.isEmpty()) {
            return null;
        }
        String text = matches.get(0).text().trim();
        return text.isEmpty() ? null : text;
    }

    private List<Element> safeSelect(Document document, String selector) {
        try {
            return document.select(selector);
        } catch (Selector.SelectorParseException e) {
            log.debug("Invalid selector '{}': {}", selector, e.getMessage());
            return List.of();
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static String firstNonBlank(String first, String second) {
        return first != null ? first : second;
    }
}
