package com.wsdlbridge.generator.schema;

/**
 * Exhaustive dispatch over the structural type variants.
 */
public interface StructuralTypeVisitor<R> {
    R visit(PrimitiveType type);
    R visit(SimpleNamedType type);
    R visit(SequenceType type);
    R visit(ChoiceType type);
    R visit(ComplexExtensionType type);
}
