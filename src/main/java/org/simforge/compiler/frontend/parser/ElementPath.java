package org.simforge.compiler.frontend.parser;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A compiled element path, a small subset of the path syntax commonly used to locate
 * elements in namespaced documents.
 * <ul>
 *   <li>segments are separated by {@code /}; a leading {@code ./} is ignored</li>
 *   <li>a leading {@code .//} makes the first segment match at any depth below the context</li>
 *   <li>{@code {*}Name} and {@code Name} match the local name in any namespace,
 *       {@code {uri}Name} requires the namespace, {@code *} matches any element</li>
 *   <li>a final {@code @attr} segment selects an attribute of the matched element</li>
 *   <li>{@code .} or the empty path selects the context element</li>
 * </ul>
 * Instances are immutable.
 */
public final class ElementPath {

    private record Step(String namespace, String localName, boolean descendant) {
        boolean matches(Element e) {
            if (!"*".equals(localName) && !localName.equals(localNameOf(e))) {
                return false;
            }
            return namespace == null || namespace.equals(e.getNamespaceURI());
        }
    }

    private final String source;
    private final List<Step> steps;
    private final String attribute;

    private ElementPath(String source, List<Step> steps, String attribute) {
        this.source = source;
        this.steps = steps;
        this.attribute = attribute;
    }

    /**
     * Compiles the textual path.
     *
     * @param path The path expression.
     * @return The compiled path.
     * @throws IllegalArgumentException if the path contains an empty segment.
     */
    public static ElementPath compile(String path) {
        String rest = path == null ? "" : path.trim();
        boolean descendant = false;
        if (rest.startsWith(".//")) {
            descendant = true;
            rest = rest.substring(3);
        } else if (rest.startsWith("./")) {
            rest = rest.substring(2);
        } else if (".".equals(rest)) {
            rest = "";
        }

        List<Step> steps = new ArrayList<>();
        String attribute = null;
        if (!rest.isEmpty()) {
            String[] segments = rest.split("/");
            for (int i = 0; i < segments.length; i++) {
                String segment = segments[i].trim();
                if (segment.isEmpty()) {
                    throw new IllegalArgumentException("Empty segment in element path '" + path + "'");
                }
                if (segment.startsWith("@")) {
                    if (i != segments.length - 1) {
                        throw new IllegalArgumentException("Attribute segment must be last in element path '" + path + "'");
                    }
                    attribute = segment.substring(1);
                    continue;
                }
                steps.add(parseStep(segment, descendant && i == 0, path));
            }
        }
        return new ElementPath(path, List.copyOf(steps), attribute);
    }

    private static Step parseStep(String segment, boolean descendant, String path) {
        if (segment.startsWith("{")) {
            int close = segment.indexOf('}');
            if (close < 0) {
                throw new IllegalArgumentException("Unterminated namespace in element path '" + path + "'");
            }
            String ns = segment.substring(1, close);
            return new Step("*".equals(ns) ? null : ns, segment.substring(close + 1), descendant);
        }
        return new Step(null, segment, descendant);
    }

    /**
     * @return All elements selected by this path below the context, in document order.
     *         An attribute segment is ignored here.
     */
    public List<Element> findAll(Element context) {
        List<Element> current = List.of(context);
        for (Step step : steps) {
            List<Element> next = new ArrayList<>();
            for (Element e : current) {
                if (step.descendant()) {
                    collectDescendants(e, step, next);
                } else {
                    collectChildren(e, step, next);
                }
            }
            current = next;
            if (current.isEmpty()) {
                break;
            }
        }
        return current;
    }

    /**
     * @return The first element selected by this path, if any.
     */
    public Optional<Element> findFirst(Element context) {
        List<Element> all = findAll(context);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /**
     * Evaluates the path to text: the trimmed text content of the first selected element,
     * or the selected attribute's value. Returns an empty string if nothing matches.
     */
    public String text(Element context) {
        Optional<Element> target = findFirst(context);
        if (target.isEmpty()) {
            return "";
        }
        if (attribute != null) {
            return target.get().hasAttribute(attribute) ? target.get().getAttribute(attribute).trim() : "";
        }
        String text = target.get().getTextContent();
        return text == null ? "" : text.trim();
    }

    public boolean isEmpty() {
        return steps.isEmpty() && attribute == null;
    }

    @Override
    public String toString() {
        return source;
    }

    private static void collectChildren(Element parent, Step step, List<Element> out) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE && step.matches((Element) n)) {
                out.add((Element) n);
            }
        }
    }

    private static void collectDescendants(Element parent, Step step, List<Element> out) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node n = children.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                Element e = (Element) n;
                if (step.matches(e)) {
                    out.add(e);
                }
                collectDescendants(e, step, out);
            }
        }
    }

    private static String localNameOf(Element e) {
        return e.getLocalName() != null ? e.getLocalName() : e.getTagName();
    }
}
