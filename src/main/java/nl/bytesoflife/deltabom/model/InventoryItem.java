package nl.bytesoflife.deltabom.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A catalog entry from the parts inventory. Text fields are never null; a missing
 * column is an empty string.
 */
public class InventoryItem {

    /** Priority used when the inventory row has no explicit ranking. */
    public static final int DEFAULT_PRIORITY = 99;

    private final String internalPartNumber;
    private final String category;
    private final String value;
    private final String packageName;
    private final String tolerance;
    private final String voltage;
    private final String amperage;
    private final String wattage;
    private final String manufacturer;
    private final String manufacturerPartNumber;
    private final String distributorId;
    private final String smd;
    private final int priority;
    private final Map<String, String> attributes;
    private final CategoryAttributes details;

    private InventoryItem(Builder builder) {
        if (builder.internalPartNumber == null || builder.internalPartNumber.isBlank()) {
            throw new IllegalArgumentException("Inventory item must have an internal part number");
        }
        this.internalPartNumber = builder.internalPartNumber.trim();
        this.category = builder.category;
        this.value = builder.value;
        this.packageName = builder.packageName;
        this.tolerance = builder.tolerance;
        this.voltage = builder.voltage;
        this.amperage = builder.amperage;
        this.wattage = builder.wattage;
        this.manufacturer = builder.manufacturer;
        this.manufacturerPartNumber = builder.manufacturerPartNumber;
        this.distributorId = builder.distributorId;
        this.smd = builder.smd;
        this.priority = builder.priority;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.details = CategoryAttributes.from(category, attributes);
    }

    public static Builder builder(String internalPartNumber) {
        return new Builder(internalPartNumber);
    }

    /**
     * Parses a priority column. Blank or non-numeric text yields {@link #DEFAULT_PRIORITY}.
     */
    public static int parsePriority(String text) {
        if (text == null || text.isBlank()) {
            return DEFAULT_PRIORITY;
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return DEFAULT_PRIORITY;
        }
    }

    public String getInternalPartNumber() { return internalPartNumber; }
    public String getCategory() { return category; }
    public String getValue() { return value; }
    public String getPackageName() { return packageName; }
    public String getTolerance() { return tolerance; }
    public String getVoltage() { return voltage; }
    public String getAmperage() { return amperage; }
    public String getWattage() { return wattage; }
    public String getManufacturer() { return manufacturer; }
    public String getManufacturerPartNumber() { return manufacturerPartNumber; }
    public String getDistributorId() { return distributorId; }
    public String getSmd() { return smd; }
    public int getPriority() { return priority; }

    /**
     * All raw inventory columns, including ones that also map to a typed field.
     */
    public Map<String, String> getAttributes() { return attributes; }

    public CategoryAttributes getDetails() { return details; }

    /**
     * Looks up a raw column case-insensitively, returning an empty string when absent.
     */
    public String attribute(String name) {
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            if (entry.getKey().trim().equalsIgnoreCase(name)) {
                return entry.getValue() == null ? "" : entry.getValue().trim();
            }
        }
        return "";
    }

    @Override
    public String toString() {
        return "InventoryItem{ipn='" + internalPartNumber + "', category='" + category +
                "', value='" + value + "', package='" + packageName + "', priority=" + priority + "}";
    }

    public static class Builder {
        private final String internalPartNumber;
        private String category = "";
        private String value = "";
        private String packageName = "";
        private String tolerance = "";
        private String voltage = "";
        private String amperage = "";
        private String wattage = "";
        private String manufacturer = "";
        private String manufacturerPartNumber = "";
        private String distributorId = "";
        private String smd = "";
        private int priority = DEFAULT_PRIORITY;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder(String internalPartNumber) {
            this.internalPartNumber = internalPartNumber;
        }

        public Builder category(String category) { this.category = clean(category); return this; }
        public Builder value(String value) { this.value = clean(value); return this; }
        public Builder packageName(String packageName) { this.packageName = clean(packageName); return this; }
        public Builder tolerance(String tolerance) { this.tolerance = clean(tolerance); return this; }
        public Builder voltage(String voltage) { this.voltage = clean(voltage); return this; }
        public Builder amperage(String amperage) { this.amperage = clean(amperage); return this; }
        public Builder wattage(String wattage) { this.wattage = clean(wattage); return this; }
        public Builder manufacturer(String manufacturer) { this.manufacturer = clean(manufacturer); return this; }
        public Builder manufacturerPartNumber(String mpn) { this.manufacturerPartNumber = clean(mpn); return this; }
        public Builder distributorId(String distributorId) { this.distributorId = clean(distributorId); return this; }
        public Builder smd(String smd) { this.smd = clean(smd); return this; }
        public Builder priority(int priority) { this.priority = priority; return this; }

        public Builder attribute(String name, String value) {
            Objects.requireNonNull(name, "name");
            attributes.put(name, clean(value));
            return this;
        }

        public Builder attributes(Map<String, String> values) {
            if (values != null) {
                values.forEach(this::attribute);
            }
            return this;
        }

        public InventoryItem build() {
            return new InventoryItem(this);
        }

        private static String clean(String text) {
            return text == null ? "" : text.trim();
        }
    }
}
