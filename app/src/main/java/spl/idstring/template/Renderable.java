package spl.idstring.template;

/**
 * A context value that knows how to turn itself into text.
 */
@FunctionalInterface
public interface Renderable {

    String render();
}
