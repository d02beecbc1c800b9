package com.visualsearch.crawler.crawl.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visualsearch.crawler.crawl.model.CrawlerConfig;
import com.visualsearch.crawler.crawl.model.ProductCandidate;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProductExtractorTest {
    private static final String PAGE = "https://shop.example.com/p/chair";

    private final ProductExtractor extractor = new ProductExtractor(new ObjectMapper());

    @Test
    void extractsProductFromJsonLdGraph() {
        String html =
            """
                <html><head>
                  <script type="application/ld+json">
                    {"@context":"https://schema.org","@graph":[
                      {"@type":"BreadcrumbList","name":"crumbs"},
                      {"@type":["Product"],"name":"Oak Chair","sku":"CH-1",
                       "description":"Solid oak","url":"/p/chair",
                       "category":{"name":"Chairs"},
                       "image":[{"url":"/img/chair-1.jpg"},"https://cdn.example.com/chair-2.jpg"],
                       "offers":{"@type":"Offer","price":"1.299,00","priceCurrency":"USD"}}
                    ]}
                  </script>
                </head><body></body></html>
                """;

        List<ProductCandidate> products = extractor.extractProducts(html, PAGE, CrawlerConfig.defaults());

        assertThat(products).hasSize(1);
        ProductCandidate product = products.get(0);
        assertThat(product.name()).isEqualTo("Oak Chair");
        assertThat(product.externalId()).isEqualTo("CH-1");
        assertThat(product.price()).isEqualByComparingTo(new BigDecimal("1299.00"));
        assertThat(product.currency()).isEqualTo("USD");
        assertThat(product.productUrl()).isEqualTo("https://shop.example.com/p/chair");
        assertThat(product.category()).isEqualTo("Chairs");
        assertThat(product.imageUrls())
            .containsExactly("https://shop.example.com/img/chair-1.jpg", "https://cdn.example.com/chair-2.jpg");
        assertThat(product.rawPayload()).contains("Oak Chair");
    }

    @Test
    void numericPriceWithoutCurrencyDefaultsToEuro() {
        String html =
            """
                <script type="application/ld+json">
                  {"@type":"Product","name":"Lamp","offers":[{"price":49.5}]}
                </script>
                """;

        ProductCandidate product = extractor.extractProducts(html, PAGE, CrawlerConfig.defaults()).get(0);

        assertThat(product.price()).isEqualByComparingTo(new BigDecimal("49.5"));
        assertThat(product.currency()).isEqualTo("EUR");
        assertThat(product.productUrl()).isEqualTo(PAGE);
    }

    @Test
    void imageAsPlainStringOrSingleObject() {
        String html =
            """
                <script type="application/ld+json">
                  [{"@type":"Product","name":"Stool","sku":"ST-1","image":"/img/stool.jpg"},
                   {"@type":"Product","name":"Bench","sku":"BE-1","image":{"@type":"ImageObject","url":"https://cdn.example.com/bench.jpg"}}]
                </script>
                """;

        List<ProductCandidate> products = extractor.extractProducts(html, PAGE, CrawlerConfig.defaults());

        assertThat(products).hasSize(2);
        assertThat(products.get(0).imageUrls()).containsExactly("https://shop.example.com/img/stool.jpg");
        assertThat(products.get(1).imageUrls()).containsExactly("https://cdn.example.com/bench.jpg");
    }

    @Test
    void malformedAndNamelessStructuredDataIsSkipped() {
        String html =
            """
                <script type="application/ld+json">{ not json</script>
                <script type="application/ld+json">{"@type":"Product","sku":"NO-NAME"}</script>
                """;

        assertThat(extractor.extractProducts(html, PAGE, CrawlerConfig.defaults())).isEmpty();
    }

    @Test
    void selectorExtractionUsesConfiguredSelectors() {
        String html =
            """
                <div class="card">
                  <h3 class="title">Walnut Table</h3>
                  <span class="price">349,90 €</span>
                  <a class="link" href="/p/table">view</a>
                  <img class="pic" data-src="/img/table.jpg">
                </div>
                <div class="card"><span class="price">10</span></div>
                <div class="card"><h3 class="title">Stool</h3></div>
                """;

        List<ProductCandidate> products = extractor.extractProducts(html, "https://shop.example.com/tables", selectorConfig());

        assertThat(products).extracting(ProductCandidate::name).containsExactly("Walnut Table", "Stool");
        ProductCandidate table = products.get(0);
        assertThat(table.price()).isEqualByComparingTo(new BigDecimal("349.90"));
        assertThat(table.currency()).isEqualTo("EUR");
        assertThat(table.productUrl()).isEqualTo("https://shop.example.com/p/table");
        assertThat(table.imageUrls()).containsExactly("https://shop.example.com/img/table.jpg");
        assertThat(table.rawPayload()).contains("\"source\":\"selectors\"");
        ProductCandidate stool = products.get(1);
        assertThat(stool.price()).isNull();
        assertThat(stool.currency()).isNull();
        assertThat(stool.productUrl()).isEqualTo("https://shop.example.com/tables");
    }

    @Test
    void structuredAndSelectorCandidatesForSameUrlAreMerged() {
        String html =
            """
                <script type="application/ld+json">
                  {"@type":"Product","name":"Oak Chair","sku":"CH-1","url":"https://shop.example.com/p/chair"}
                </script>
                <div class="card">
                  <h3 class="title">Oak Chair (card)</h3>
                  <a class="link" href="/p/chair?ref=card">view</a>
                </div>
                """;

        List<ProductCandidate> products = extractor.extractProducts(html, PAGE, selectorConfig());

        assertThat(products).extracting(ProductCandidate::name).containsExactly("Oak Chair");
    }

    @Test
    void openGraphFallbackOnlyWhenNothingElseMatched() {
        String html =
            """
                <html><head>
                  <meta property="og:type" content="product">
                  <meta property="og:title" content="Linen Sofa">
                  <meta property="og:image" content="/img/sofa.jpg">
                  <meta property="product:price:amount" content="899.00">
                  <meta property="product:price:currency" content="GBP">
                  <meta property="product:retailer_item_id" content="SOFA-7">
                </head><body></body></html>
                """;

        List<ProductCandidate> products = extractor.extractProducts(html, "https://shop.example.com/p/sofa", CrawlerConfig.defaults());

        assertThat(products).hasSize(1);
        ProductCandidate sofa = products.get(0);
        assertThat(sofa.name()).isEqualTo("Linen Sofa");
        assertThat(sofa.externalId()).isEqualTo("SOFA-7");
        assertThat(sofa.currency()).isEqualTo("GBP");
        assertThat(sofa.imageUrls()).containsExactly("https://shop.example.com/img/sofa.jpg");
        assertThat(sofa.productUrl()).isEqualTo("https://shop.example.com/p/sofa");

        String withStructured = html.replace("</head>",
            "<script type=\"application/ld+json\">{\"@type\":\"Product\",\"name\":\"Sofa JSON\"}</script></head>");
        assertThat(extractor.extractProducts(withStructured, "https://shop.example.com/p/sofa", CrawlerConfig.defaults()))
            .extracting(ProductCandidate::name)
            .containsExactly("Sofa JSON");
    }

    @Test
    void nonProductOpenGraphPageYieldsNothing() {
        String html = "<meta property=\"og:type\" content=\"website\"><meta property=\"og:title\" content=\"Home\">";

        assertThat(extractor.extractProducts(html, PAGE, CrawlerConfig.defaults())).isEmpty();
    }

    private CrawlerConfig selectorConfig() {
        CrawlerConfig config = new CrawlerConfig();
        config.setProductContainerSelector("div.card");
        config.setProductNameSelector(".title");
        config.setProductPriceSelector(".price");
        config.setProductLinkSelector("a.link");
        config.setProductImageSelector("img.pic");
        return config;
    }
}
