package com.partselect.assistant.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KnowledgeBaseLoaderTest {

    @Test
    void splitsOnBlankLines() {
        assertThat(KnowledgeBaseLoader.splitParagraphs("first\nstill first\n\n\n\nsecond\r\n\r\nthird  "))
                .containsExactly("first\nstill first", "second", "third");
    }

    @Test
    void combinesTextHtmlAndCatalogDocuments(@TempDir Path tempDir) throws Exception {
        Path page = tempDir.resolve("guide.html");
        Files.writeString(page, "<html><body><nav>menu</nav><main>Check the <b>drain hose</b> for kinks.</main></body></html>");

        KnowledgeBaseLoader loader = new KnowledgeBaseLoader(new DefaultResourceLoader(),
                "classpath:knowledge/knowledge_base.txt", List.of("file:" + tempDir + "/*.html"), true);

        List<String> docs = loader.load(CatalogFixtures.sampleCatalog());

        assertThat(docs).contains("Check the drain hose for kinks.");
        assertThat(docs).anySatisfy(doc -> assertThat(doc).startsWith("Refrigerator Door Shelf Bin (PS11752778)")
                .contains("Models: WRS325SDHZ08, WRF535SWHZ."));
        assertThat(docs).anySatisfy(doc -> assertThat(doc).startsWith("Dishwasher not draining"));
    }

    @Test
    void missingSourcesGiveEmptyCorpus() {
        KnowledgeBaseLoader loader = new KnowledgeBaseLoader(new DefaultResourceLoader(),
                "classpath:knowledge/nope.txt", List.of(), false);

        assertThat(loader.load(CatalogFixtures.sampleCatalog())).isEmpty();
    }
}
