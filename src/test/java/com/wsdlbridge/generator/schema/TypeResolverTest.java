package com.wsdlbridge.generator.schema;

import static com.wsdlbridge.generator.schema.TestSchemas.qn;
import static com.wsdlbridge.generator.schema.TestSchemas.xsd;
import static org.assertj.core.api.Assertions.*;

import org.apache.ws.commons.schema.XmlSchemaElement;
import org.junit.jupiter.api.Test;

import com.wsdlbridge.generator.codegen.context.ConversionDiagnostics;

/**
 * Unit tests for TypeResolver and the structural classification of schema types.
 */
class TypeResolverTest {

    private static final String SCHEMA = """
            <xs:complexType name="Person">
              <xs:sequence>
                <xs:element name="name" type="xs:string"/>
                <xs:element name="age" type="xs:int"/>
                <xs:element name="nickname" type="xs:string" maxOccurs="unbounded"/>
              </xs:sequence>
            </xs:complexType>
            <xs:complexType name="Shape">
              <xs:choice>
                <xs:element name="circle" type="xs:double"/>
                <xs:element name="square" type="xs:double"/>
              </xs:choice>
            </xs:complexType>
            <xs:complexType name="Employee">
              <xs:complexContent>
                <xs:extension base="tns:Person">
                  <xs:sequence>
                    <xs:element name="employeeId" type="xs:long"/>
                  </xs:sequence>
                </xs:extension>
              </xs:complexContent>
            </xs:complexType>
            <xs:complexType name="Money">
              <xs:simpleContent>
                <xs:extension base="xs:decimal">
                  <xs:attribute name="currency" type="xs:string"/>
                </xs:extension>
              </xs:simpleContent>
            </xs:complexType>
            <xs:simpleType name="Colour">
              <xs:restriction base="xs:string">
                <xs:enumeration value="RED"/>
                <xs:enumeration value="BLUE"/>
              </xs:restriction>
            </xs:simpleType>
            <xs:complexType name="Empty"/>
            <xs:element name="Item" type="xs:string"/>
            <xs:element name="Basket">
              <xs:complexType>
                <xs:sequence>
                  <xs:element ref="tns:Item" maxOccurs="unbounded"/>
                  <xs:element name="owner" type="tns:Person"/>
                </xs:sequence>
              </xs:complexType>
            </xs:element>
            """;

    private final ConversionDiagnostics diagnostics = new ConversionDiagnostics();
    private final TypeResolver resolver = new TypeResolver(TestSchemas.universe(SCHEMA), diagnostics);

    @Test
    void testResolveSequenceType() {
        StructuralType type = resolver.resolveType(qn("Person"));

        assertThat(type).isInstanceOf(SequenceType.class);
        assertThat(type.getQualifiedName()).isEqualTo(qn("Person"));
        assertThat(type.isSimple()).isFalse();

        SequenceType sequence = (SequenceType) type;
        assertThat(sequence.getChildren()).extracting(ChildElement::getName)
                .containsExactly("name", "age", "nickname");
        assertThat(sequence.getChildren().get(2).isRepeated()).isTrue();
        assertThat(sequence.getSingleSequenceChild()).isNull();
    }

    @Test
    void testResolveChoiceType() {
        StructuralType type = resolver.resolveType(qn("Shape"));

        assertThat(type).isInstanceOf(ChoiceType.class);
        assertThat(((ChoiceType) type).getChildren()).hasSize(2);
    }

    @Test
    void testResolveComplexContentExtension() {
        StructuralType type = resolver.resolveType(qn("Employee"));

        assertThat(type).isInstanceOf(ComplexExtensionType.class);
        ComplexExtensionType extension = (ComplexExtensionType) type;
        assertThat(extension.isSimpleContent()).isFalse();
        assertThat(extension.getBaseTypeName()).isEqualTo(qn("Person"));
        assertThat(extension.getChildren()).extracting(ChildElement::getName).containsExactly("employeeId");
    }

    @Test
    void testResolveSimpleContentExtension() {
        StructuralType type = resolver.resolveType(qn("Money"));

        assertThat(type).isInstanceOf(ComplexExtensionType.class);
        ComplexExtensionType extension = (ComplexExtensionType) type;
        assertThat(extension.isSimpleContent()).isTrue();
        assertThat(extension.getBaseTypeName()).isEqualTo(xsd("decimal"));
        assertThat(extension.getChildren()).isEmpty();
    }

    @Test
    void testSchemaSimpleTypeIsSimpleNamed() {
        StructuralType type = resolver.resolveType(qn("Colour"));

        assertThat(type).isInstanceOf(SimpleNamedType.class);
        assertThat(resolver.isSimple(type)).isTrue();
    }

    @Test
    void testComplexTypeWithoutContentIsEmptySequence() {
        StructuralType type = resolver.resolveType(qn("Empty"));

        assertThat(type).isInstanceOf(SequenceType.class);
        assertThat(((SequenceType) type).getChildren()).isEmpty();
    }

    @Test
    void testBuiltInFallback() {
        assertThat(resolver.resolveType(xsd("string"))).isInstanceOf(PrimitiveType.class);
        assertThat(resolver.resolveType(xsd("dateTime")).getLocalName()).isEqualTo("dateTime");
        assertThat(resolver.resolveType(xsd("anyURI"))).isInstanceOf(SimpleNamedType.class);
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testUnknownTypeResolvesToNullWithWarning() {
        assertThat(resolver.resolveType(qn("Missing"))).isNull();
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0)).contains("Missing");
    }

    @Test
    void testNullIsTreatedAsSimple() {
        assertThat(resolver.resolveType(null)).isNull();
        assertThat(resolver.isSimple(null)).isTrue();
    }

    @Test
    void testFindGlobalElementAndAnonymousType() {
        XmlSchemaElement basket = resolver.findGlobalElement(qn("Basket"));
        assertThat(basket).isNotNull();

        StructuralType type = resolver.resolveElementType(basket);
        assertThat(type).isInstanceOf(SequenceType.class);
        assertThat(type.isAnonymous()).isTrue();
        assertThat(resolver.resolveElementType(basket)).isSameAs(type);
    }

    @Test
    void testElementReferenceChildUsesReferencedElement() {
        SequenceType basket = (SequenceType) resolver.resolveElementType(resolver.findGlobalElement(qn("Basket")));

        ChildElement item = basket.getChildren().get(0);
        assertThat(item.getName()).isEqualTo("Item");
        assertThat(item.isRepeated()).isTrue();
        assertThat(resolver.resolveChildType(item)).isInstanceOf(PrimitiveType.class);

        ChildElement owner = basket.getChildren().get(1);
        assertThat(resolver.resolveChildType(owner).getQualifiedName()).isEqualTo(qn("Person"));
    }

    @Test
    void testMissingGlobalElement() {
        assertThat(resolver.findGlobalElement(qn("Nope"))).isNull();
        assertThat(diagnostics.hasWarnings()).isTrue();
    }
}
