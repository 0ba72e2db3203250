package com.vidnyan.sysml.domain.metamodel;

import com.vidnyan.sysml.domain.model.*;
import com.vidnyan.sysml.domain.syntax.SyntaxNode;

import java.math.BigDecimal;
import java.math.BigInteger;

import static com.vidnyan.sysml.domain.metamodel.Kinds.*;

/**
 * The KerML kind table with the SysML kinds built on it.
 */
public final class KermlMetamodel {

    private KermlMetamodel() {
    }

    public static MetamodelDescription create() {
        MetamodelDescription.Builder builder = MetamodelDescription.builder();
        roots(builder);
        annotations(builder);
        relationships(builder);
        classifiers(builder);
        features(builder);
        expressions(builder);
        sysml(builder);
        return builder.build();
    }

    private static void roots(MetamodelDescription.Builder builder) {
        builder.kind(KindDefinition.builder(ELEMENT).factory(ElementMeta::new))
                .kind(KindDefinition.builder(RELATIONSHIP).supertypes(ELEMENT)
                        .factory(RelationshipMeta::new)
                        .initializer(KermlMetamodel::initRelationship))
                .kind(KindDefinition.builder(NAMESPACE).supertypes(ELEMENT).factory(NamespaceMeta::new))
                .kind(KindDefinition.builder(PACKAGE).supertypes(NAMESPACE))
                .kind(KindDefinition.builder(LIBRARY_PACKAGE).supertypes(PACKAGE));
    }

    private static void annotations(MetamodelDescription.Builder builder) {
        builder.kind(KindDefinition.builder(COMMENT).supertypes(ELEMENT)
                        .factory(AnnotationMeta::new)
                        .initializer(KermlMetamodel::initAnnotation))
                .kind(KindDefinition.builder(DOCUMENTATION).supertypes(COMMENT))
                .kind(KindDefinition.builder(TEXTUAL_REPRESENTATION).supertypes(ELEMENT)
                        .factory(AnnotationMeta::new)
                        .initializer(KermlMetamodel::initAnnotation));
    }

    private static void relationships(MetamodelDescription.Builder builder) {
        builder.kind(KindDefinition.builder(MEMBERSHIP).supertypes(RELATIONSHIP).factory(MembershipMeta::new))
                .kind(KindDefinition.builder(OWNING_MEMBERSHIP).supertypes(MEMBERSHIP))
                .kind(KindDefinition.builder(FEATURE_MEMBERSHIP).supertypes(OWNING_MEMBERSHIP))
                .kind(KindDefinition.builder(FEATURE_VALUE).supertypes(OWNING_MEMBERSHIP))
                .kind(KindDefinition.builder(END_FEATURE_MEMBERSHIP).supertypes(FEATURE_MEMBERSHIP))
                .kind(KindDefinition.builder(PARAMETER_MEMBERSHIP).supertypes(FEATURE_MEMBERSHIP))
                .kind(KindDefinition.builder(RESULT_EXPRESSION_MEMBERSHIP).supertypes(FEATURE_MEMBERSHIP))
                .kind(KindDefinition.builder(RETURN_PARAMETER_MEMBERSHIP).supertypes(PARAMETER_MEMBERSHIP))

                .kind(KindDefinition.builder(IMPORT).supertypes(RELATIONSHIP)
                        .factory(ImportMeta::new)
                        .initializer(KermlMetamodel::initImport))
                .kind(KindDefinition.builder(MEMBERSHIP_IMPORT).supertypes(IMPORT))
                .kind(KindDefinition.builder(NAMESPACE_IMPORT).supertypes(IMPORT))

                .kind(heritage(SPECIALIZATION, SpecializationKind.SPECIALIZATION, RELATIONSHIP)
                        .factory(SpecializationMeta::new))
                .kind(heritage(SUBCLASSIFICATION, SpecializationKind.SUBCLASSIFICATION, SPECIALIZATION))
                .kind(heritage(FEATURE_TYPING, SpecializationKind.TYPING, SPECIALIZATION))
                .kind(heritage(CONJUGATED_PORT_TYPING, SpecializationKind.CONJUGATED_PORT_TYPING, FEATURE_TYPING))
                .kind(heritage(SUBSETTING, SpecializationKind.SUBSETTING, SPECIALIZATION))
                .kind(heritage(REDEFINITION, SpecializationKind.REDEFINITION, SUBSETTING))
                .kind(heritage(REFERENCE_SUBSETTING, SpecializationKind.REFERENCE, SUBSETTING))
                .kind(heritage(CONJUGATION, SpecializationKind.CONJUGATION, RELATIONSHIP)
                        .factory(SpecializationMeta::new))

                .kind(KindDefinition.builder(DISJOINING).supertypes(RELATIONSHIP))
                .kind(KindDefinition.builder(UNIONING).supertypes(RELATIONSHIP))
                .kind(KindDefinition.builder(INTERSECTING).supertypes(RELATIONSHIP))
                .kind(KindDefinition.builder(DIFFERENCING).supertypes(RELATIONSHIP))
                .kind(KindDefinition.builder(FEATURE_INVERTING).supertypes(RELATIONSHIP))
                .kind(KindDefinition.builder(TYPE_FEATURING).supertypes(RELATIONSHIP))
                .kind(KindDefinition.builder(FEATURE_CHAINING).supertypes(RELATIONSHIP))
                .kind(KindDefinition.builder(DEPENDENCY).supertypes(RELATIONSHIP));
    }

    private static KindDefinition.Builder heritage(String kind, SpecializationKind specializationKind, String supertype) {
        return KindDefinition.builder(kind)
                .supertypes(supertype)
                .initializer((meta, node) -> ((SpecializationMeta) meta).setSpecializationKind(specializationKind));
    }

    private static void classifiers(MetamodelDescription.Builder builder) {
        builder.kind(KindDefinition.builder(TYPE).supertypes(NAMESPACE)
                        .factory(TypeMeta::new)
                        .implicit("base", "Base::Anything")
                        .initializer((meta, node) -> ((TypeMeta) meta).setAbstract(node.flag(SyntaxNode.ABSTRACT))))
                .kind(KindDefinition.builder(CLASSIFIER).supertypes(TYPE)
                        .factory(ClassifierMeta::new)
                        .implicit("base", "Base::Anything"))
                .kind(classifier(DATA_TYPE, TypeClassifier.DATA_TYPE, CLASSIFIER)
                        .implicit("base", "Base::DataValue"))
                .kind(classifier(CLASS, TypeClassifier.CLASS, CLASSIFIER)
                        .implicit("base", "Occurrences::Occurrence"))
                .kind(classifier(STRUCTURE, TypeClassifier.STRUCTURE, CLASS)
                        .implicit("base", "Objects::Object"))
                .kind(KindDefinition.builder(BEHAVIOR).supertypes(CLASS)
                        .implicit("base", "Performances::Performance"))
                .kind(KindDefinition.builder(FUNCTION).supertypes(BEHAVIOR)
                        .implicit("base", "Performances::Evaluation"))
                .kind(KindDefinition.builder(PREDICATE).supertypes(FUNCTION)
                        .implicit("base", "Performances::BooleanEvaluation"))
                .kind(classifier(ASSOCIATION, TypeClassifier.ASSOCIATION, CLASSIFIER, RELATIONSHIP)
                        .factory(ClassifierMeta::new)
                        .implicit("base", "Links::Link")
                        .implicit("binary", "Links::BinaryLink"))
                .kind(KindDefinition.builder(ASSOCIATION_STRUCTURE).supertypes(ASSOCIATION, STRUCTURE)
                        .factory(ClassifierMeta::new)
                        .implicit("base", "Objects::ObjectLink")
                        .implicit("binary", "Objects::BinaryLinkObject"))
                .kind(KindDefinition.builder(METACLASS).supertypes(STRUCTURE)
                        .implicit("base", "Metaobjects::Metaobject"));
    }

    private static KindDefinition.Builder classifier(String kind, int flags, String... supertypes) {
        return KindDefinition.builder(kind)
                .supertypes(supertypes)
                .initializer((meta, node) -> ((TypeMeta) meta).addClassifier(flags));
    }

    private static void features(MetamodelDescription.Builder builder) {
        builder.kind(KindDefinition.builder(FEATURE).supertypes(TYPE)
                        .factory(FeatureMeta::new)
                        .implicit("base", "Base::things")
                        .implicit("dataValue", "Base::dataValues")
                        .implicit("occurrence", "Occurrences::occurrences")
                        .implicit("suboccurrence", "Occurrences::Occurrence::suboccurrences")
                        .implicit("object", "Objects::objects")
                        .implicit("subobject", "Objects::Object::subobjects")
                        .implicit("participant", "Links::Link::participant")
                        .initializer(KermlMetamodel::initFeature))
                .kind(KindDefinition.builder(STEP).supertypes(FEATURE)
                        .factory(StepMeta::new)
                        .implicit("base", "Performances::performances")
                        .implicit("enclosedPerformance", "Performances::Performance::enclosedPerformances")
                        .implicit("subperformance", "Performances::Performance::subperformances")
                        .implicit("ownedPerformance", "Objects::Object::ownedPerformances")
                        .implicit("incomingTransfer", "Occurrences::Occurrence::incomingTransfers"))
                .kind(KindDefinition.builder(CONNECTOR).supertypes(FEATURE, RELATIONSHIP)
                        .factory(ConnectorMeta::new)
                        .implicit("base", "Links::links")
                        .implicit("binary", "Links::binaryLinks")
                        .implicit("object", "Objects::linkObjects")
                        .implicit("binaryObject", "Objects::binaryLinkObjects"))
                .kind(KindDefinition.builder(BINDING_CONNECTOR).supertypes(CONNECTOR)
                        .implicit("base", "Links::selfLinks")
                        .implicit("binary", "Links::selfLinks"))
                .kind(KindDefinition.builder(SUCCESSION).supertypes(CONNECTOR)
                        .implicit("base", "Occurrences::happensBeforeLinks")
                        .implicit("binary", "Occurrences::happensBeforeLinks"))
                .kind(KindDefinition.builder(ITEM_FLOW).supertypes(CONNECTOR, STEP)
                        .factory(ItemFlowMeta::new)
                        .implicit("base", "Transfers::flowTransfers"))
                .kind(KindDefinition.builder(SUCCESSION_ITEM_FLOW).supertypes(ITEM_FLOW, SUCCESSION)
                        .factory(ItemFlowMeta::new)
                        .implicit("base", "Transfers::flowTransfersBefore"))
                .kind(KindDefinition.builder(METADATA_FEATURE).supertypes(FEATURE)
                        .factory(MetadataFeatureMeta::new)
                        .implicit("base", "Metaobjects::metaobjects"))
                .kind(KindDefinition.builder(MULTIPLICITY).supertypes(FEATURE)
                        .factory(MultiplicityMeta::new)
                        .implicit("base", "Base::naturals")
                        .implicit("feature", "Base::exactlyOne")
                        .implicit("classifier", "Base::zeroOrOne"))
                .kind(KindDefinition.builder(MULTIPLICITY_RANGE).supertypes(MULTIPLICITY)
                        .implicit("feature", "Base::naturals")
                        .implicit("classifier", "Base::naturals"));
    }

    private static void expressions(MetamodelDescription.Builder builder) {
        builder.kind(KindDefinition.builder(EXPRESSION).supertypes(STEP)
                        .factory(ExpressionMeta::new)
                        .implicit("base", "Performances::evaluations")
                        .initializer(KermlMetamodel::initExpression))
                .kind(KindDefinition.builder(BOOLEAN_EXPRESSION).supertypes(EXPRESSION)
                        .implicit("base", "Performances::booleanEvaluations"))
                .kind(KindDefinition.builder(INVARIANT).supertypes(BOOLEAN_EXPRESSION)
                        .factory(InvariantMeta::new)
                        .implicit("base", "Performances::trueEvaluations")
                        .implicit("negated", "Performances::falseEvaluations")
                        .initializer((meta, node) -> ((InvariantMeta) meta).setNegated(node.flag(SyntaxNode.NEGATED))))

                .kind(KindDefinition.builder(LITERAL_EXPRESSION).supertypes(EXPRESSION)
                        .factory(LiteralExpressionMeta::new)
                        .implicit("base", "Performances::literalEvaluations")
                        .initializer((meta, node) -> ((LiteralExpressionMeta) meta).setLiteral(literalValue(node))))
                .kind(KindDefinition.builder(LITERAL_BOOLEAN).supertypes(LITERAL_EXPRESSION))
                .kind(KindDefinition.builder(LITERAL_NUMBER).supertypes(LITERAL_EXPRESSION))
                .kind(KindDefinition.builder(LITERAL_STRING).supertypes(LITERAL_EXPRESSION))
                .kind(KindDefinition.builder(LITERAL_INFINITY).supertypes(LITERAL_EXPRESSION))
                .kind(KindDefinition.builder(NULL_EXPRESSION).supertypes(EXPRESSION)
                        .factory(NullExpressionMeta::new)
                        .implicit("base", "Performances::nullEvaluations"))

                .kind(KindDefinition.builder(INVOCATION_EXPRESSION).supertypes(EXPRESSION)
                        .factory(InvocationExpressionMeta::new))
                .kind(KindDefinition.builder(OPERATOR_EXPRESSION).supertypes(INVOCATION_EXPRESSION)
                        .factory(OperatorExpressionMeta::new)
                        .initializer((meta, node) -> ((OperatorExpressionMeta) meta).setOperator(node.operator())))
                .kind(KindDefinition.builder(FEATURE_CHAIN_EXPRESSION).supertypes(OPERATOR_EXPRESSION)
                        .factory(FeatureChainExpressionMeta::new)
                        .initializer((meta, node) -> {
                            OperatorExpressionMeta expression = (OperatorExpressionMeta) meta;
                            if (expression.operator() == null) expression.setOperator(".");
                        }))
                .kind(KindDefinition.builder(FEATURE_REFERENCE_EXPRESSION).supertypes(EXPRESSION)
                        .factory(FeatureReferenceExpressionMeta::new))
                .kind(KindDefinition.builder(METADATA_ACCESS_EXPRESSION).supertypes(EXPRESSION)
                        .factory(MetadataAccessExpressionMeta::new));
    }

    private static void sysml(MetamodelDescription.Builder builder) {
        builder.kind(KindDefinition.builder(DEFINITION).supertypes(CLASSIFIER))
                .kind(KindDefinition.builder(USAGE).supertypes(FEATURE).factory(UsageMeta::new))
                .kind(KindDefinition.builder(ATTRIBUTE_DEFINITION).supertypes(DATA_TYPE, DEFINITION)
                        .implicit("base", "Base::DataValue"))
                .kind(KindDefinition.builder(OCCURRENCE_DEFINITION).supertypes(CLASS, DEFINITION)
                        .implicit("base", "Occurrences::Occurrence"))
                .kind(KindDefinition.builder(ITEM_DEFINITION).supertypes(OCCURRENCE_DEFINITION, STRUCTURE)
                        .implicit("base", "Items::Item"))
                .kind(KindDefinition.builder(PART_DEFINITION).supertypes(ITEM_DEFINITION)
                        .implicit("base", "Parts::Part"))
                .kind(KindDefinition.builder(ACTION_DEFINITION).supertypes(BEHAVIOR, OCCURRENCE_DEFINITION)
                        .implicit("base", "Actions::Action"))
                .kind(KindDefinition.builder(ATTRIBUTE_USAGE).supertypes(USAGE)
                        .implicit("base", "Base::dataValues"))
                .kind(KindDefinition.builder(OCCURRENCE_USAGE).supertypes(USAGE)
                        .implicit("base", "Occurrences::occurrences"))
                .kind(KindDefinition.builder(ITEM_USAGE).supertypes(OCCURRENCE_USAGE)
                        .implicit("base", "Items::items"))
                .kind(KindDefinition.builder(PART_USAGE).supertypes(ITEM_USAGE)
                        .implicit("base", "Parts::parts"))
                .kind(KindDefinition.builder(ACTION_USAGE).supertypes(OCCURRENCE_USAGE, STEP)
                        .factory(UsageMeta::new)
                        .implicit("base", "Actions::actions"));
    }

    // connectors and associations are relationships by kind but not by meta class
    private static void initRelationship(ElementMeta meta, SyntaxNode node) {
        if (meta instanceof RelationshipMeta relationship && node.reference() != null && !node.reference().isBlank()) {
            relationship.setReference(new ElementReference(node.reference()));
        }
    }

    private static void initImport(ElementMeta meta, SyntaxNode node) {
        ImportMeta importMeta = (ImportMeta) meta;
        ImportKind importKind = ImportKind.fromReference(node.reference());
        importMeta.setImportKind(importKind);
        importMeta.setImportsAll(node.flag(SyntaxNode.IMPLIED));
        if (node.reference() != null && !node.reference().isBlank()) {
            importMeta.setReference(new ElementReference(importKind.stripSuffix(node.reference())));
        }
    }

    private static void initAnnotation(ElementMeta meta, SyntaxNode node) {
        ((AnnotationMeta) meta).setBody(node.body());
    }

    private static void initFeature(ElementMeta meta, SyntaxNode node) {
        FeatureMeta feature = (FeatureMeta) meta;
        feature.setDirection(Direction.parse(node.direction()));
        feature.setComposite(node.flag(SyntaxNode.COMPOSITE));
        feature.setPortion(node.flag(SyntaxNode.PORTION));
        feature.setReadonly(node.flag(SyntaxNode.READONLY));
        feature.setDerived(node.flag(SyntaxNode.DERIVED));
        feature.setEnd(node.flag(SyntaxNode.END));
        feature.setNonunique(node.flag(SyntaxNode.NONUNIQUE));
        feature.setOrdered(node.flag(SyntaxNode.ORDERED));
    }

    private static void initExpression(ElementMeta meta, SyntaxNode node) {
        if (node.reference() != null && !node.reference().isBlank()) {
            ((ExpressionMeta) meta).setReference(new ElementReference(node.reference()));
        }
    }

    /**
     * Integral numbers become {@link Long}, other numbers {@link Double}.
     */
    static Object literalValue(SyntaxNode node) {
        Object value = node.value();
        if (node.kind().equals(LITERAL_INFINITY)) return null;
        if (value instanceof String text) {
            if (node.kind().equals(LITERAL_BOOLEAN)) return Boolean.parseBoolean(text.trim());
            if (node.kind().equals(LITERAL_NUMBER)) return parseNumber(text.trim(), node.flag(SyntaxNode.INTEGER));
            return text;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            double number = ((Number) value).doubleValue();
            if (node.flag(SyntaxNode.INTEGER) && number == Math.rint(number)) return (long) number;
            return number;
        }
        if (value instanceof BigInteger big) return big.longValue();
        if (value instanceof Number number) return number.longValue();
        return value;
    }

    private static Object parseNumber(String text, boolean integer) {
        try {
            if (integer || !(text.contains(".") || text.contains("e") || text.contains("E"))) {
                return Long.parseLong(text);
            }
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return text;
        }
    }
}
