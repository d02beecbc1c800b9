package com.visualsearch.crawler.crawl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.visualsearch.crawler.crawl.model.CrawlerConfig;
import com.visualsearch.crawler.crawl.model.ProductCandidate;
import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts one candidate per element matched by the provider's container selector.
 */
public class SelectorProductExtractor {
    private static final Logger log = LoggerFactory.getLogger(SelectorProductExtractor.class);
    private static final String[] IMAGE_ATTRIBUTES = {"src", "data-src", "data-lazy-src"};

    private final ObjectMapper objectMapper;

    public SelectorProductExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ProductCandidate> extract(Document document, String pageUrl, CrawlerConfig config) {
        String containerSelector = config.getProductContainerSelector();
        if (containerSelector == null || containerSelector.isBlank()) {
            return List.of();
        }
        List<Element> containers;
        try {
            containers = document.select(containerSelector);
        } catch (Selector.SelectorParseException e) {
            log.warn("Invalid product container selector '{}': {}", containerSelector, e.getMessage());
            return List.of();
        }

        List<ProductCandidate> products = new ArrayList<>();
        for (Element container : containers) {
            String name = selectText(container, config.getProductNameSelector());
            if (name == null) {
                continue;
            }
            String priceText = selectText(container, config.getProductPriceSelector());
            BigDecimal price = PriceParser.parse(priceText);
            String description = selectText(container, config.getProductDescriptionSelector());
            String link = selectLink(container, config.getProductLinkSelector(), pageUrl);
            List<String> images = selectImages(container, config.getProductImageSelector(), pageUrl);
            String currency = price == null ? null : ProductExtractor.DEFAULT_CURRENCY;
            products.add(new ProductCandidate(
                null,
                name,
                description,
                price,
                currency,
                link,
                null,
                images,
                rawPayload(name, priceText, description, link, images)
            ));
        }
        return products;
    }

    private String selectText(Element container, String selector) {
        Element element = selectFirst(container, selector);
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    private String selectLink(Element container, String selector, String pageUrl) {
        Element element = selectFirst(container, selector);
        if (element == null) {
            return null;
        }
        return CrawlUrlUtils.resolve(pageUrl, element.attr("href"));
    }

    private List<String> selectImages(Element container, String selector, String pageUrl) {
        List<String> images = new ArrayList<>();
        if (selector == null || selector.isBlank()) {
            return images;
        }
        for (Element image : safeSelect(container, selector)) {
            for (String attribute : IMAGE_ATTRIBUTES) {
                String resolved = CrawlUrlUtils.resolve(pageUrl, image.attr(attribute));
                if (resolved != null) {
                    if (!images.contains(resolved)) {
                        images.add(resolved);
                    }
                    break;
                }
            }
        }
        return images;
    }

    private Element selectFirst(Element container, String selector) {
        if (selector == null || selector.isBlank()) {
            return null;
        }
        List<Element> matches = safeSelect(container, selector);
        return matches.isEmpty() ? null : matches.get(0);
    }

    private List<Element> safeSelect(Element container, String selector) {
        try {
            return container.select(selector);
        } catch (Selector.SelectorParseException e) {
            log.debug("Invalid selector '{}': {}", selector, e.getMessage());
            return List.of();
        }
    }

    private String rawPayload(String name, String price, String description, String link, List<String> images) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("source", "selectors");
        node.put("name", name);
        node.put("price", price);
        node.put("description", description);
        node.put("url", link);
        images.forEach(node.putArray("images")::add);
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize selector payload", e);
        }
    }
}
