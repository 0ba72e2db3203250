package com.vidnyan.sysml.domain.metamodel;

/**
 * Kind tags of the syntax tree and the semantic model.
 */
public final class Kinds {

    private Kinds() {
    }

    // Root kinds
    public static final String ELEMENT = "Element";
    public static final String RELATIONSHIP = "Relationship";
    public static final String NAMESPACE = "Namespace";
    public static final String PACKAGE = "Package";
    public static final String LIBRARY_PACKAGE = "LibraryPackage";

    // Annotations
    public static final String COMMENT = "Comment";
    public static final String DOCUMENTATION = "Documentation";
    public static final String TEXTUAL_REPRESENTATION = "TextualRepresentation";

    // Types and classifiers
    public static final String TYPE = "Type";
    public static final String CLASSIFIER = "Classifier";
    public static final String DATA_TYPE = "DataType";
    public static final String CLASS = "Class";
    public static final String STRUCTURE = "Structure";
    public static final String BEHAVIOR = "Behavior";
    public static final String FUNCTION = "Function";
    public static final String PREDICATE = "Predicate";
    public static final String ASSOCIATION = "Association";
    public static final String ASSOCIATION_STRUCTURE = "AssociationStructure";
    public static final String METACLASS = "Metaclass";

    // Features
    public static final String FEATURE = "Feature";
    public static final String STEP = "Step";
    public static final String EXPRESSION = "Expression";
    public static final String BOOLEAN_EXPRESSION = "BooleanExpression";
    public static final String INVARIANT = "Invariant";
    public static final String CONNECTOR = "Connector";
    public static final String BINDING_CONNECTOR = "BindingConnector";
    public static final String SUCCESSION = "Succession";
    public static final String ITEM_FLOW = "ItemFlow";
    public static final String SUCCESSION_ITEM_FLOW = "SuccessionItemFlow";
    public static final String METADATA_FEATURE = "MetadataFeature";
    public static final String MULTIPLICITY = "Multiplicity";
    public static final String MULTIPLICITY_RANGE = "MultiplicityRange";

    // Expressions
    public static final String LITERAL_EXPRESSION = "LiteralExpression";
    public static final String LITERAL_BOOLEAN = "LiteralBoolean";
    public static final String LITERAL_NUMBER = "LiteralNumber";
    public static final String LITERAL_STRING = "LiteralString";
    public static final String LITERAL_INFINITY = "LiteralInfinity";
    public static final String NULL_EXPRESSION = "NullExpression";
    public static final String INVOCATION_EXPRESSION = "InvocationExpression";
    public static final String OPERATOR_EXPRESSION = "OperatorExpression";
    public static final String FEATURE_CHAIN_EXPRESSION = "FeatureChainExpression";
    public static final String FEATURE_REFERENCE_EXPRESSION = "FeatureReferenceExpression";
    public static final String METADATA_ACCESS_EXPRESSION = "MetadataAccessExpression";

    // Memberships
    public static final String MEMBERSHIP = "Membership";
    public static final String OWNING_MEMBERSHIP = "OwningMembership";
    public static final String FEATURE_MEMBERSHIP = "FeatureMembership";
    public static final String END_FEATURE_MEMBERSHIP = "EndFeatureMembership";
    public static final String PARAMETER_MEMBERSHIP = "ParameterMembership";
    public static final String RETURN_PARAMETER_MEMBERSHIP = "ReturnParameterMembership";
    public static final String RESULT_EXPRESSION_MEMBERSHIP = "ResultExpressionMembership";
    public static final String FEATURE_VALUE = "FeatureValue";

    // Imports
    public static final String IMPORT = "Import";
    public static final String MEMBERSHIP_IMPORT = "MembershipImport";
    public static final String NAMESPACE_IMPORT = "NamespaceImport";

    // Specializations and other type relationships
    public static final String SPECIALIZATION = "Specialization";
    public static final String SUBCLASSIFICATION = "Subclassification";
    public static final String FEATURE_TYPING = "FeatureTyping";
    public static final String CONJUGATED_PORT_TYPING = "ConjugatedPortTyping";
    public static final String SUBSETTING = "Subsetting";
    public static final String REDEFINITION = "Redefinition";
    public static final String REFERENCE_SUBSETTING = "ReferenceSubsetting";
    public static final String CONJUGATION = "Conjugation";
    public static final String DISJOINING = "Disjoining";
    public static final String UNIONING = "Unioning";
    public static final String INTERSECTING = "Intersecting";
    public static final String DIFFERENCING = "Differencing";
    public static final String FEATURE_INVERTING = "FeatureInverting";
    public static final String TYPE_FEATURING = "TypeFeaturing";
    public static final String FEATURE_CHAINING = "FeatureChaining";
    public static final String DEPENDENCY = "Dependency";

    // SysML
    public static final String DEFINITION = "Definition";
    public static final String USAGE = "Usage";
    public static final String ATTRIBUTE_DEFINITION = "AttributeDefinition";
    public static final String ATTRIBUTE_USAGE = "AttributeUsage";
    public static final String OCCURRENCE_DEFINITION = "OccurrenceDefinition";
    public static final String OCCURRENCE_USAGE = "OccurrenceUsage";
    public static final String ITEM_DEFINITION = "ItemDefinition";
    public static final String ITEM_USAGE = "ItemUsage";
    public static final String PART_DEFINITION = "PartDefinition";
    public static final String PART_USAGE = "PartUsage";
    public static final String ACTION_DEFINITION = "ActionDefinition";
    public static final String ACTION_USAGE = "ActionUsage";
}
