package com.visualcalc.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine settings, loaded from the {@code visualcalc} namespace:
 * <pre>
 * visualcalc.formula-marker=
 * visualcalc.element-prefix=E
 * visualcalc.default-content=0
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "visualcalc")
public class VisualCalcProperties {

    /**
     * Prefix that forces content to be read as a formula.
     */
    private String formulaMarker = "=";

    /**
     * Prefix of auto-generated element names (E1, E2, ...).
     */
    private String elementPrefix = "E";

    /**
     * Content given to a freshly added element.
     */
    private String defaultContent = "0";

    public String getFormulaMarker() {
        return formulaMarker;
    }

    public void setFormulaMarker(String formulaMarker) {
        this.formulaMarker = formulaMarker;
    }

    public String getElementPrefix() {
        return elementPrefix;
    }

    public void setElementPrefix(String elementPrefix) {
        this.elementPrefix = elementPrefix;
    }

    public String getDefaultContent() {
        return defaultContent;
    }

    public void setDefaultContent(String defaultContent) {
        this.defaultContent = defaultContent;
    }
}
