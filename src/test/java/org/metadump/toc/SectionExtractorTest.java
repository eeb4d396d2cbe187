package org.metadump.toc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.metadump.output.Section;

@Tag("integration")
class SectionExtractorTest {

    private static final String SHELL = "\n\nCREATE TYPE public.größe;";
    private static final String FUNCTION = "\n\nCREATE FUNCTION public.größe_in(cstring) RETURNS public.größe AS $_$x$_$\nLANGUAGE c;";
    private static final String TYPE = "\n\nCREATE TYPE public.größe (\n\tINPUT = public.größe_in\n);";

    @TempDir
    Path tempDir;

    private Path predata;
    private TableOfContents toc;

    @BeforeEach
    void setUp() throws IOException {
        predata = tempDir.resolve("metadata_predata.sql");
        Files.writeString(predata, SHELL + FUNCTION + TYPE, StandardCharsets.UTF_8);

        long shellEnd = bytes(SHELL);
        long functionEnd = shellEnd + bytes(FUNCTION);
        long typeEnd = functionEnd + bytes(TYPE);
        toc = new TableOfContents();
        toc.addEntry(Section.PREDATA, "public", "größe", "SHELL TYPE", 0, shellEnd);
        toc.addEntry(Section.PREDATA, "public", "größe_in", "FUNCTION", shellEnd, functionEnd);
        toc.addEntry(Section.PREDATA, "public", "größe", "TYPE", functionEnd, typeEnd);
        toc.addEntry(Section.PREDATA, "public", "unused", "FUNCTION", typeEnd, typeEnd);
    }

    private static long bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    @Test
    void extractsExactlyOneObject() throws IOException {
        SectionExtractor extractor = new SectionExtractor(toc, Map.of(Section.PREDATA, predata));

        assertThat(extractor.extract(Section.PREDATA, "public", "größe_in")).containsExactly(FUNCTION);
        assertThat(extractor.extract(Section.PREDATA, "public", "größe")).containsExactly(SHELL, TYPE);
        assertThat(extractor.extract(toc.find(Section.PREDATA, "public", "unused", "FUNCTION").orElseThrow()))
                .isEmpty();
    }

    @Test
    void matchingEntriesConcatenateInEmissionOrder() throws IOException {
        SectionExtractor extractor = new SectionExtractor(toc, Map.of(Section.PREDATA, predata));

        assertThat(extractor.extractMatching(Section.PREDATA, entry -> true)).isEqualTo(SHELL + FUNCTION + TYPE);
        assertThat(extractor.extractMatching(Section.PREDATA, entry -> entry.kind().equals("TYPE"))).isEqualTo(TYPE);
    }

    @Test
    void truncatedSectionFileIsReported() throws IOException {
        Files.writeString(predata, SHELL, StandardCharsets.UTF_8);
        SectionExtractor extractor = new SectionExtractor(toc, Map.of(Section.PREDATA, predata));

        assertThatThrownBy(() -> extractor.extract(Section.PREDATA, "public", "größe_in"))
                .isInstanceOf(IOException.class);
    }
}
