package com.vidnyan.sysml.domain.model;

import com.vidnyan.sysml.domain.metamodel.TypeIndex;

/**
 * Import statement of a namespace.
 */
public class ImportMeta extends RelationshipMeta {

    private ImportKind importKind = ImportKind.SPECIFIC;
    private boolean importsAll;

    public ImportMeta(int id, String kind, TypeIndex typeIndex) {
        super(id, kind, typeIndex);
    }

    public ImportKind importKind() {
        return importKind;
    }

    public void setImportKind(ImportKind importKind) {
        this.importKind = importKind;
    }

    /**
     * True if visibility filtering is skipped for imported members.
     */
    public boolean importsAll() {
        return importsAll;
    }

    public void setImportsAll(boolean importsAll) {
        this.importsAll = importsAll;
    }

    /**
     * Imports default to private.
     */
    @Override
    public Visibility visibility() {
        return declaredVisibility() != null ? declaredVisibility() : Visibility.PRIVATE;
    }
}
