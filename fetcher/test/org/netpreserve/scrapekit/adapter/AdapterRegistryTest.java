package org.netpreserve.scrapekit.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;
import org.netpreserve.scrapekit.auth.LoginVerdict;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdapterRegistryTest {
    /**
     * Treats pages with a product grid as lists and pages with a price as details.
     */
    static class ShopAdapter implements SiteAdapter {
        @Override
        public PageType classifyPage(Document page, URI url) {
            if (!page.select(".product").isEmpty()) return PageType.LIST;
            if (page.selectFirst(".price") != null) return PageType.DETAIL;
            return PageType.GENERIC;
        }

        @Override
        public JsonNode extractList(Document page, URI url) {
            var array = JsonNodeFactory.instance.arrayNode();
            page.select(".product a").forEach(link -> array.add(link.absUrl("href")));
            return array;
        }

        @Override
        public JsonNode extractDetail(Document page, URI url) {
            return JsonNodeFactory.instance.objectNode()
                    .put("url", url.toString())
                    .put("price", page.selectFirst(".price").text());
        }

        @Override
        public JsonNode extractGeneric(Document page, URI url) {
            return JsonNodeFactory.instance.objectNode().put("title", page.title());
        }
    }

    @Test
    void lookupCreatesFreshAdapters() {
        var registry = new AdapterRegistry().register("shop", ShopAdapter::new);
        var first = registry.lookup("shop").orElseThrow();
        var second = registry.lookup("shop").orElseThrow();
        assertInstanceOf(ShopAdapter.class, first);
        assertNotSame(first, second);
        assertTrue(registry.lookup("bank").isEmpty());
    }

    @Test
    void rejectsDuplicateAndBlankIds() {
        var registry = new AdapterRegistry().register("shop", ShopAdapter::new);
        assertThrows(IllegalArgumentException.class, () -> registry.register("shop", ShopAdapter::new));
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", ShopAdapter::new));
    }

    @Test
    void idsAreSorted() {
        var registry = new AdapterRegistry()
                .register("zoo", ShopAdapter::new)
                .register("alpha", ShopAdapter::new);
        assertEquals(List.of("alpha", "zoo"), List.copyOf(registry.ids()));
    }

    @Test
    void extractDispatchesOnPageType() {
        var adapter = new ShopAdapter();
        var base = URI.create("https://shop.example/");

        var list = Jsoup.parse("<div class=product><a href=/p/1>One</a></div>" +
                               "<div class=product><a href=/p/2>Two</a></div>", base.toString());
        assertEquals("https://shop.example/p/2", adapter.extract(list, base).get(1).asText());

        var detail = Jsoup.parse("<h1>One</h1><span class=price>9.99</span>");
        assertEquals("9.99", adapter.extract(detail, base.resolve("/p/1")).get("price").asText());

        var other = Jsoup.parse("<title>About us</title>");
        assertEquals("About us", adapter.extract(other, base).get("title").asText());
    }

    @Test
    void loginVerdictDefaultsToUndecided() {
        assertEquals(LoginVerdict.UNDECIDED, new ShopAdapter().verifyLogin("anything"));
    }
}
