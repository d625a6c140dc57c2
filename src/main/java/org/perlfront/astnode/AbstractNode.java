package org.perlfront.astnode;

import org.perlfront.astvisitor.PrintVisitor;
import org.perlfront.lexer.Span;

import java.util.HashMap;
import java.util.Map;

/**
 * Abstract base class for syntax tree nodes. Holds the node id, the source span
 * and an optional map of annotations.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor
 */
public abstract class AbstractNode implements Node {
    public int id;
    public final Span location;

    // Lazy initialization - only created when first annotation is set
    public Map<String, Object> annotations;

    protected AbstractNode(Span location) {
        this.location = location;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public void setId(int id) {
        this.id = id;
    }

    @Override
    public Span getLocation() {
        return location;
    }

    /**
     * Returns a string representation of the syntax tree.
     *
     * @return an indented dump of this node and its children
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }

    public void setAnnotation(String key, Object value) {
        if (annotations == null) {
            annotations = new HashMap<>();
        }
        annotations.put(key, value);
    }

    public Object getAnnotation(String key) {
        return annotations == null ? null : annotations.get(key);
    }

    public boolean getBooleanAnnotation(String key) {
        Object value = getAnnotation(key);
        return value instanceof Boolean && (Boolean) value;
    }
}
