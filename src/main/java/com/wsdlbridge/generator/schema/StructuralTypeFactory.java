package com.wsdlbridge.generator.schema;

import java.util.ArrayList;
import java.util.List;

import javax.xml.namespace.QName;

import org.apache.ws.commons.schema.XmlSchemaChoice;
import org.apache.ws.commons.schema.XmlSchemaChoiceMember;
import org.apache.ws.commons.schema.XmlSchemaComplexContentExtension;
import org.apache.ws.commons.schema.XmlSchemaComplexType;
import org.apache.ws.commons.schema.XmlSchemaContent;
import org.apache.ws.commons.schema.XmlSchemaContentModel;
import org.apache.ws.commons.schema.XmlSchemaElement;
import org.apache.ws.commons.schema.XmlSchemaParticle;
import org.apache.ws.commons.schema.XmlSchemaSequence;
import org.apache.ws.commons.schema.XmlSchemaSequenceMember;
import org.apache.ws.commons.schema.XmlSchemaSimpleContentExtension;
import org.apache.ws.commons.schema.XmlSchemaType;

import lombok.experimental.UtilityClass;

/**
 * Classifies an XmlSchema type object into one of the structural variants.
 */
@UtilityClass
public class StructuralTypeFactory {

    public StructuralType classify(XmlSchemaType type) {
        QName name = type.getQName();

        if (BuiltInTypes.isXsdNamespace(name)) {
            return BuiltInTypes.isPrimitive(name)
                    ? new PrimitiveType(name, type)
                    : new SimpleNamedType(name, type);
        }
        if (!(type instanceof XmlSchemaComplexType complexType)) {
            return new SimpleNamedType(name, type);
        }

        XmlSchemaContentModel contentModel = complexType.getContentModel();
        if (contentModel != null) {
            XmlSchemaContent content = contentModel.getContent();
            if (content instanceof XmlSchemaComplexContentExtension extension) {
                XmlSchemaParticle particle = extension.getParticle();
                List<ChildElement> children = new ArrayList<>();
                int particles = collectChildren(particle, children);
                return new ComplexExtensionType(name, type, extension.getBaseTypeName(), false,
                        particle instanceof XmlSchemaSequence, children, particles);
            }
            if (content instanceof XmlSchemaSimpleContentExtension extension) {
                return new ComplexExtensionType(name, type, extension.getBaseTypeName(), true,
                        false, List.of(), 0);
            }
            return new SequenceType(name, type, List.of(), 0);
        }

        XmlSchemaParticle particle = complexType.getParticle();
        List<ChildElement> children = new ArrayList<>();
        int particles = collectChildren(particle, children);
        if (particle instanceof XmlSchemaChoice) {
            return new ChoiceType(name, type, children, particles);
        }
        if (particle instanceof XmlSchemaSequence) {
            return new SequenceType(name, type, children, particles);
        }
        return new SequenceType(name, type, List.of(), 0);
    }

    /**
     * Adds the element particles of a sequence or choice to {@code children}, returning the
     * total number of particles including non-element ones.
     */
    private int collectChildren(XmlSchemaParticle particle, List<ChildElement> children) {
        if (particle instanceof XmlSchemaSequence sequence) {
            for (XmlSchemaSequenceMember member : sequence.getItems()) {
                if (member instanceof XmlSchemaElement element) {
                    children.add(ChildElement.of(element));
                }
            }
            return sequence.getItems().size();
        }
        if (particle instanceof XmlSchemaChoice choice) {
            for (XmlSchemaChoiceMember member : choice.getItems()) {
                if (member instanceof XmlSchemaElement element) {
                    children.add(ChildElement.of(element));
                }
            }
            return choice.getItems().size();
        }
        return 0;
    }
}
