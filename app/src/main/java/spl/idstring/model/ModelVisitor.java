package spl.idstring.model;

import java.util.List;

/**
 * Receives the sorted entity collections of a {@link ProteinModel}, one call per {@link Category}.
 */
public interface ModelVisitor {

    void visitChains(List<Chain> chains);

    void visitPolymers(List<Polymer> polymers);

    void visitSubstitutions(List<SubstitutionPoint> points);

    void visitAttachments(List<AttachmentPoint> attachments);
}
