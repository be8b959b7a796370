package spl.idstring.template;

import java.util.Map;

/**
 * Element of a parsed template: either literal text or a variable reference.
 */
public interface TemplateNode {

    String render(Map<String, ?> context, UnresolvedVariablePolicy policy);
}
