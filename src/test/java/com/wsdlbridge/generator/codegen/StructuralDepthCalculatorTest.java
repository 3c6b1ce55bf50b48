package com.wsdlbridge.generator.codegen;

import static com.wsdlbridge.generator.schema.TestSchemas.qn;
import static com.wsdlbridge.generator.schema.TestSchemas.xsd;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.wsdlbridge.generator.codegen.context.ConversionDiagnostics;
import com.wsdlbridge.generator.schema.TestSchemas;
import com.wsdlbridge.generator.schema.TypeResolver;

class StructuralDepthCalculatorTest {

    private static final String SCHEMA = """
            <xs:complexType name="Flat">
              <xs:sequence>
                <xs:element name="a" type="xs:string"/>
                <xs:element name="b" type="xs:int"/>
              </xs:sequence>
            </xs:complexType>
            <xs:complexType name="Nested">
              <xs:sequence>
                <xs:element name="id" type="xs:string"/>
                <xs:element name="flat" type="tns:Flat"/>
              </xs:sequence>
            </xs:complexType>
            <xs:complexType name="Deeper">
              <xs:choice>
                <xs:element name="nested" type="tns:Nested"/>
                <xs:element name="none" type="xs:string"/>
              </xs:choice>
            </xs:complexType>
            <xs:complexType name="Empty">
              <xs:sequence/>
            </xs:complexType>
            <xs:complexType name="Tree">
              <xs:sequence>
                <xs:element name="label" type="xs:string"/>
                <xs:element name="child" type="tns:Tree" minOccurs="0" maxOccurs="unbounded"/>
              </xs:sequence>
            </xs:complexType>
            <xs:complexType name="FlatExtension">
              <xs:complexContent>
                <xs:extension base="tns:Nested">
                  <xs:sequence>
                    <xs:element name="extra" type="xs:string"/>
                  </xs:sequence>
                </xs:extension>
              </xs:complexContent>
            </xs:complexType>
            <xs:complexType name="Amount">
              <xs:simpleContent>
                <xs:extension base="xs:decimal"/>
              </xs:simpleContent>
            </xs:complexType>
            """;

    private final TypeResolver resolver = new TypeResolver(TestSchemas.universe(SCHEMA), new ConversionDiagnostics());
    private final StructuralDepthCalculator calculator = new StructuralDepthCalculator(resolver);

    @Test
    void testSimpleAndMissingTypesHaveDepthZero() {
        assertThat(calculator.computeDepth(null)).isZero();
        assertThat(calculator.computeDepth(resolver.resolveType(xsd("string")))).isZero();
    }

    @Test
    void testFlatSequenceHasDepthOne() {
        assertThat(calculator.computeDepth(resolver.resolveType(qn("Flat")))).isEqualTo(1);
    }

    @Test
    void testNestedSequenceHasDepthTwo() {
        assertThat(calculator.computeDepth(resolver.resolveType(qn("Nested")))).isEqualTo(2);
    }

    @Test
    void testChoiceChildrenCount() {
        assertThat(calculator.computeDepth(resolver.resolveType(qn("Deeper")))).isEqualTo(3);
    }

    @Test
    void testEmptySequenceHasDepthZero() {
        assertThat(calculator.computeDepth(resolver.resolveType(qn("Empty")))).isZero();
    }

    @Test
    void testRecursiveTypeTerminates() {
        assertThat(calculator.computeDepth(resolver.resolveType(qn("Tree")))).isEqualTo(2);
    }

    @Test
    void testExtensionCountsOwnChildrenOnly() {
        assertThat(calculator.computeDepth(resolver.resolveType(qn("FlatExtension")))).isEqualTo(1);
    }

    @Test
    void testSimpleContentHasNoElementChildren() {
        assertThat(calculator.computeDepth(resolver.resolveType(qn("Amount")))).isZero();
    }
}
