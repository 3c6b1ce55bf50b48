package com.wsdlbridge.generator.codegen;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

import com.wsdlbridge.generator.schema.ChildElement;
import com.wsdlbridge.generator.schema.ChoiceType;
import com.wsdlbridge.generator.schema.ComplexExtensionType;
import com.wsdlbridge.generator.schema.PrimitiveType;
import com.wsdlbridge.generator.schema.SequenceType;
import com.wsdlbridge.generator.schema.SimpleNamedType;
import com.wsdlbridge.generator.schema.StructuralType;
import com.wsdlbridge.generator.schema.StructuralTypeVisitor;
import com.wsdlbridge.generator.schema.StructuredType;
import com.wsdlbridge.generator.schema.TypeResolver;

/**
 * Nesting depth of structured element content.
 *
 * Simple and unresolved types have depth 0. A structured type has depth 1 + the greatest depth
 * among its element children, or 0 when it has no element children. Simple-content
 * extensions have no element children. A type that reaches itself again through its
 * children counts that reference as depth 1.
 */
public class StructuralDepthCalculator {

    private final TypeResolver typeResolver;

    public StructuralDepthCalculator(TypeResolver typeResolver) {
        this.typeResolver = Objects.requireNonNull(typeResolver, "typeResolver");
    }

    public int computeDepth(StructuralType type) {
        return depth(type, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private int depth(StructuralType type, Set<StructuralType> inProgress) {
        if (type == null) {
            return 0;
        }
        if (!inProgress.add(type)) {
            return 1;
        }
        try {
            return type.accept(new StructuralTypeVisitor<Integer>() {
                @Override
                public Integer visit(PrimitiveType primitive) {
                    return 0;
                }

                @Override
                public Integer visit(SimpleNamedType simple) {
                    return 0;
                }

                @Override
                public Integer visit(SequenceType sequence) {
                    return childDepth(sequence, inProgress);
                }

                @Override
                public Integer visit(ChoiceType choice) {
                    return childDepth(choice, inProgress);
                }

                @Override
                public Integer visit(ComplexExtensionType extension) {
                    return childDepth(extension, inProgress);
                }
            });
        } finally {
            inProgress.remove(type);
        }
    }

    private int childDepth(StructuredType type, Set<StructuralType> inProgress) {
        int max = 0;
        for (ChildElement child : type.getChildren()) {
            max = Math.max(max, 1 + depth(typeResolver.resolveChildType(child), inProgress));
        }
        return max;
    }
}
