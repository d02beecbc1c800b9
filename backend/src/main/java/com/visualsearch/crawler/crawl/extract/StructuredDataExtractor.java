package com.visualsearch.crawler.crawl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visualsearch.crawler.crawl.model.ProductCandidate;
import com.visualsearch.crawler.crawl.util.CrawlUrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads schema.org {@code Product} items from {@code application/ld+json} blocks.
 */
public class StructuredDataExtractor {
    private static final Logger log = LoggerFactory.getLogger(StructuredDataExtractor.class);

    private final ObjectMapper objectMapper;

    public StructuredDataExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ProductCandidate> extract(Document document, String pageUrl) {
        List<JsonNode> productNodes = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collectProductNodes(objectMapper.readTree(payload), productNodes);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed structured data block on {}: {}", pageUrl, e.getOriginalMessage());
            }
        }

        List<ProductCandidate> products = new ArrayList<>();
        for (JsonNode node : productNodes) {
            ProductCandidate candidate = toCandidate(node, pageUrl);
            if (candidate != null) {
                products.add(candidate);
            }
        }
        return products;
    }

    private void collectProductNodes(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectProductNodes(child, out);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if (isProductType(node.get("@type"))) {
            out.add(node);
            return;
        }
        node.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isArray() || value.isObject()) {
                collectProductNodes(value, out);
            }
        });
    }

    private boolean isProductType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return "product".equalsIgnoreCase(typeNode.asText().trim());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && "product".equalsIgnoreCase(child.asText().trim())) {
                    return true;
                }
            }
        }
        return false;
    }

    private ProductCandidate toCandidate(JsonNode node, String pageUrl) {
        String name = text(node, "name");
        if (name == null) {
            return null;
        }
        JsonNode offer = firstOffer(node.get("offers"));
        BigDecimal price = offer == null ? null : price(offer);
        String currency = offer == null ? null : text(offer, "priceCurrency");
        if (price != null && currency == null) {
            currency = ProductExtractor.DEFAULT_CURRENCY;
        }
        String url = text(node, "url");
        return new ProductCandidate(
            firstNonBlank(text(node, "sku"), text(node, "productID"), text(node, "mpn")),
            name,
            text(node, "description"),
            price,
            currency,
            url == null ? null : CrawlUrlUtils.resolve(pageUrl, url),
            categoryText(node.get("category")),
            images(node.get("image"), pageUrl),
            node.toString()
        );
    }

    private JsonNode firstOffer(JsonNode offers) {
        if (offers == null || offers.isNull()) {
            return null;
        }
        if (offers.isArray()) {
            return offers.isEmpty() ? null : offers.get(0);
        }
        return offers.isObject() ? offers : null;
    }

    private BigDecimal price(JsonNode offer) {
        JsonNode priceNode = offer.get("price");
        if (priceNode == null || priceNode.isNull()) {
            priceNode = offer.get("lowPrice");
        }
        if (priceNode == null || priceNode.isNull()) {
            return null;
        }
        if (priceNode.isNumber()) {
            return priceNode.decimalValue();
        }
        return PriceParser.parse(priceNode.asText());
    }

    private List<String> images(JsonNode imageNode, String pageUrl) {
        List<String> images = new ArrayList<>();
        if (imageNode == null || imageNode.isNull()) {
            return images;
        }
        if (imageNode.isArray()) {
            for (JsonNode item : imageNode) {
                addImage(images, item, pageUrl);
            }
        } else {
            addImage(images, imageNode, pageUrl);
        }
        return images;
    }

    private void addImage(List<String> images, JsonNode item, String pageUrl) {
        String raw = item.isTextual() ? item.asText() : text(item, "url");
        String resolved = CrawlUrlUtils.resolve(pageUrl, raw);
        if (resolved != null && !images.contains(resolved)) {
            images.add(resolved);
        }
    }

    private String categoryText(JsonNode category) {
        if (category == null || category.isNull()) {
            return null;
        }
        if (category.isTextual()) {
            return blankToNull(category.asText());
        }
        return text(category, "name");
    }

    static String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return blankToNull(value.asText());
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
