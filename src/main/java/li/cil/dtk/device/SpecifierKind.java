package li.cil.dtk.device;

import li.cil.dtk.devicetree.Node;
import li.cil.dtk.devicetree.Property;
import li.cil.dtk.exception.SemanticException;

import javax.annotation.Nullable;

/**
 * The kinds of phandle + specifier links a device can have to a controller.
 */
public enum SpecifierKind {
    INTERRUPT("interrupt", "#interrupt-cells", "interrupt-controller"),
    GPIO("gpio", "#gpio-cells", "gpio-controller"),
    CLOCK("clock", "#clock-cells", null),
    PWM("pwm", "#pwm-cells", null),
    ;

    /**
     * Prefix of the nexus properties, {@code <prefix>-map}, {@code <prefix>-map-mask} and
     * {@code <prefix>-map-pass-thru}.
     */
    public final String prefix;
    public final String cellsProperty;
    /**
     * Property marking a node as the final receiver, so that no nexus lookup takes place.
     */
    @Nullable public final String controllerProperty;

    SpecifierKind(final String prefix, final String cellsProperty, @Nullable final String controllerProperty) {
        this.prefix = prefix;
        this.cellsProperty = cellsProperty;
        this.controllerProperty = controllerProperty;
    }

    public String mapProperty() {
        return prefix + "-map";
    }

    public String maskProperty() {
        return prefix + "-map-mask";
    }

    public String passThroughProperty() {
        return prefix + "-map-pass-thru";
    }

    public boolean isController(final Node node) {
        return controllerProperty != null && node.hasProperty(controllerProperty);
    }

    /**
     * The number of cells in specifiers for the given controller.
     */
    public int cells(final Node controller) throws SemanticException {
        final Property property = controller.getProperty(cellsProperty);
        if (property == null) {
            throw new SemanticException(String.format("%s lacks %s", controller, cellsProperty));
        }
        return property.toCellCount();
    }
}
