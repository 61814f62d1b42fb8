package net.seoedge;

import net.seoedge.service.LocaleRegistry;
import net.seoedge.service.RedirectResolver;
import net.seoedge.service.TaggedCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Application context smoke test
 *
 * Features:
 * - Verifies the shared engines are wired as singletons
 * - Exercises the edge filter and the admin endpoints through MockMvc
 */
@SpringBootTest(properties = {
    "seo.cache.warmup-on-startup=false",
    "seo.locale.enabled-locales=en,fr,ar",
    "seo.locale.base-url=https://example.com"
})
@AutoConfigureMockMvc
class SeoEdgeApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TaggedCache taggedCache;

    @Autowired
    private RedirectResolver redirectResolver;

    @Autowired
    private LocaleRegistry localeRegistry;

    @Autowired
    @Qualifier("taskScheduler")
    private TaskScheduler taskScheduler;

    @Test
    void contextLoads() {
        assertNotNull(taggedCache);
        assertNotNull(redirectResolver);
        assertEquals("en", localeRegistry.getDefaultLocale());
        ThreadPoolTaskScheduler scheduler = assertInstanceOf(ThreadPoolTaskScheduler.class, taskScheduler);
        assertEquals("SeoScheduler-", scheduler.getThreadNamePrefix());
    }

    @Test
    void shouldRedirectNonCanonicalPageRequests() throws Exception {
        mockMvc.perform(get("/Products/"))
            .andExpect(status().isMovedPermanently())
            .andExpect(header().string("Location", "/products"))
            .andExpect(header().string("Cache-Control", "public, max-age=31536000"));
    }

    @Test
    void shouldNormalizeUrlThroughAdminEndpoint() throws Exception {
        mockMvc.perform(get("/admin/seo/urls/normalize")
                .param("url", "http://example.com/Products/Index.html?utm_source=fb&id=5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.normalized").value("https://example.com/products?id=5"));
    }

    @Test
    void shouldDetectLocaleThroughAdminEndpoint() throws Exception {
        mockMvc.perform(get("/admin/seo/locales/detect").param("acceptLanguage", "fr-FR,en;q=0.8"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.detected").value("fr"))
            .andExpect(jsonPath("$.confidence").value(1.0))
            .andExpect(jsonPath("$.source").value("header"));
    }

    @Test
    void shouldListHreflangAlternatesThroughAdminEndpoint() throws Exception {
        mockMvc.perform(get("/admin/seo/locales/hreflang").param("path", "/shoes").param("locale", "fr"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(4))
            .andExpect(jsonPath("$[1].href").value("https://example.com/fr/shoes"))
            .andExpect(jsonPath("$[3].hreflang").value("x-default"));
    }
}
