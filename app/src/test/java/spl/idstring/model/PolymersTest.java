package spl.idstring.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import spl.idstring.document.MissingFieldException;
import spl.idstring.document.SplXml;

class PolymersTest {

    @Test
    void sortsByStructureThenCode() {
        Polymers polymers = Polymers.load(SplXml.substance()
                .polymer("P3", "KEY-B")
                .polymer("P2", "KEY-A")
                .polymer("P1", "KEY-B")
                .document());

        assertThat(polymers.items()).extracting(Polymer::code).containsExactly("P2", "P1", "P3");
        assertThat(polymers.items()).extracting(Polymer::name).containsExactly("poly0", "poly1", "poly2");
        assertThat(polymers.lookup().require("P3").name()).isEqualTo("poly2");
    }

    @Test
    void polymerWithoutStructureSortsFirst() {
        Polymers polymers = Polymers.of(List.of(
                new Polymer("P1", "KEY", List.of(), null),
                new Polymer("P2", null, List.of(), null)));

        assertThat(polymers.items()).extracting(Polymer::code).containsExactly("P2", "P1");
        assertThat(polymers.items().get(0).attribute("value")).contains("");
    }

    @Test
    void readsSortedConnectionPointsAndPointQuantity() {
        Polymer polymer = Polymers.load(SplXml.substance()
                .polymer("P1", "KEY", SplXml.pointQuantity("2", "1", "mol"), List.of(new int[] {7, 8}, new int[] {1, 4}))
                .document()).items().get(0);

        assertThat(polymer.connectionPoints()).containsExactly(new ConnectionPoint(1, 4), new ConnectionPoint(7, 8));
        assertThat(polymer.attribute("connection_points")).contains("N1C4,N7C8");
        assertThat(polymer.quantity()).contains(new PointQuantity("2", "1", "mol"));
        assertThat(polymer.attribute("quantity")).contains("2:1:mol");
    }

    @Test
    void rendersRangeQuantityInIntervalNotation() {
        Polymer polymer = Polymers.load(SplXml.substance()
                .polymer("P1", "KEY", SplXml.rangeQuantity("1", true, "5", false, "1", "mol"), List.of())
                .document()).items().get(0);

        assertThat(polymer.attribute("quantity")).contains("[1,5):1:mol");
    }

    @Test
    void missingQuantityRendersEmpty() {
        Polymer polymer = Polymers.load(SplXml.substance().polymer("P1", "KEY").document()).items().get(0);

        assertThat(polymer.quantity()).isEmpty();
        assertThat(polymer.attribute("quantity")).contains("");
        assertThat(polymer.attribute("value")).contains("KEY");
    }

    @Test
    void connectionPointNeedsTwoPositions() {
        assertThatThrownBy(() -> Polymers.load(SplXml.substance()
                .polymer("P1", "KEY", "", List.of(new int[] {3}))
                .document()))
                .isInstanceOf(MissingFieldException.class)
                .hasMessage("Expecting exactly 2 connection point positions, found 1");
    }

    @Test
    void quantityNeedsDenominatorUnit() {
        String quantity = "<quantity><numerator value=\"1\"/><denominator value=\"1\"/></quantity>";

        assertThatThrownBy(() -> Polymers.load(SplXml.substance()
                .polymer("P1", "KEY", quantity, List.of())
                .document()))
                .isInstanceOf(MissingFieldException.class)
                .hasMessage("Missing quantity unit");
    }
}
