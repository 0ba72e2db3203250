package com.vidnyan.sysml.domain.build;

import com.vidnyan.sysml.domain.metamodel.MetaInitializer;
import com.vidnyan.sysml.domain.metamodel.MetamodelDescription;
import com.vidnyan.sysml.domain.metamodel.TypeIndex;
import com.vidnyan.sysml.domain.model.*;
import com.vidnyan.sysml.domain.syntax.SyntaxDocument;
import com.vidnyan.sysml.domain.syntax.SyntaxNode;

/**
 * Creates the semantic element of every syntax node of a document, in pre-order.
 * Names, visibility and the owners' member tables are filled in here;
 * nothing is linked yet.
 */
public class ModelElementFactory {

    private final MetamodelDescription description;
    private final TypeIndex typeIndex;
    private final ElementIdProvider ids;

    public ModelElementFactory(MetamodelDescription description, ElementIdProvider ids) {
        this.description = description;
        this.typeIndex = description.typeIndex();
        this.ids = ids;
    }

    /**
     * @throws IllegalArgumentException if a node has an unknown kind or the root is not a namespace
     */
    public ModelDocument create(SyntaxDocument syntax, boolean library) {
        ModelDocument document = new ModelDocument(syntax.uri(), library);
        ElementMeta root = createElement(syntax.root(), document, null);
        if (!(root instanceof NamespaceMeta namespace)) {
            throw new IllegalArgumentException(
                    "Document root must be a namespace, got " + syntax.root().kind() + " in " + syntax.uri());
        }
        document.setRoot(namespace);
        return document;
    }

    private ElementMeta createElement(SyntaxNode node, ModelDocument document, ElementMeta parent) {
        if (!typeIndex.contains(node.kind())) {
            throw new IllegalArgumentException("Unknown kind '" + node.kind() + "' in " + document.uri());
        }

        ElementMeta meta = description.factory(node.kind()).create(ids.next(), node.kind(), typeIndex);
        document.register(meta);
        meta.setNames(node.name(), node.shortName());
        meta.setDeclaredVisibility(Visibility.parse(node.visibility()));
        for (MetaInitializer initializer : description.initializers(node.kind())) {
            initializer.initialize(meta, node);
        }

        if (parent != null) {
            parent.addChild(meta);
            if (!meta.isTransparent()) {
                ElementMeta owner = meta.owner();
                if (owner != null) owner.addNamedMember(meta);
            }
        }
        for (SyntaxNode child : node.children()) {
            createElement(child, document, meta);
        }
        return meta;
    }
}
