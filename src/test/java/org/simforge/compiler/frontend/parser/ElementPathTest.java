package org.simforge.compiler.frontend.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ElementPath} evaluation against namespaced and plain documents.
 */
@Tag("unit")
class ElementPathTest {

    private Element root;

    @BeforeEach
    void setUp() throws Exception {
        String xml = """
                <Doc xmlns="urn:a" xmlns:b="urn:b">
                  <Section>
                    <Item id="1"><Name> first </Name></Item>
                    <Item id="2"><Name>second</Name></Item>
                    <b:Item id="3"><Name>third</Name></b:Item>
                  </Section>
                  <Other><Section><Item id="4"/></Section></Other>
                </Doc>
                """;
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        root = factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml))).getDocumentElement();
    }

    @Test
    void childPathMatchesLocalNameInAnyNamespace() {
        List<Element> items = ElementPath.compile("{*}Section/{*}Item").findAll(root);

        assertThat(items).extracting(e -> e.getAttribute("id")).containsExactly("1", "2", "3");
    }

    @Test
    void plainNameBehavesLikeWildcardNamespace() {
        assertThat(ElementPath.compile("Section/Item").findAll(root)).hasSize(3);
    }

    @Test
    void explicitNamespaceRestrictsMatches() {
        List<Element> items = ElementPath.compile("{urn:b}Item").findAll(
                ElementPath.compile("Section").findFirst(root).orElseThrow());

        assertThat(items).extracting(e -> e.getAttribute("id")).containsExactly("3");
    }

    @Test
    void descendantPathSearchesAllDepthsInDocumentOrder() {
        List<Element> items = ElementPath.compile(".//{*}Section/{*}Item").findAll(root);

        assertThat(items).extracting(e -> e.getAttribute("id")).containsExactly("1", "2", "3", "4");
    }

    @Test
    void textIsTrimmedAndEmptyWhenNothingMatches() {
        Element section = ElementPath.compile("./Section").findFirst(root).orElseThrow();

        assertThat(ElementPath.compile("Item/Name").text(section)).isEqualTo("first");
        assertThat(ElementPath.compile("Item/Missing").text(section)).isEmpty();
    }

    @Test
    void attributeSegmentReadsAttribute() {
        Element section = ElementPath.compile("Section").findFirst(root).orElseThrow();

        assertThat(ElementPath.compile("Item/@id").text(section)).isEqualTo("1");
        assertThat(ElementPath.compile("Item/@missing").text(section)).isEmpty();
    }

    @Test
    void dotSelectsContextElement() {
        ElementPath self = ElementPath.compile(".");

        assertThat(self.isEmpty()).isTrue();
        assertThat(self.findAll(root)).containsExactly(root);
    }

    @Test
    void malformedPathsAreRejected() {
        assertThatThrownBy(() -> ElementPath.compile("Section//Item"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ElementPath.compile("@id/Item"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ElementPath.compile("{urn:a Item"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
