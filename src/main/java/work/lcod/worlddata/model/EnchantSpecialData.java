package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class EnchantSpecialData implements ServerSideDefinition {
    @JsonProperty("id")
    private int id;

    @JsonProperty("inputItem")
    private int inputItem;

    @JsonProperty("resultItem")
    private int resultItem;

    private EnchantSpecialData() {}

    public EnchantSpecialData(int id, int inputItem, int resultItem) {
        this.id = id;
        this.inputItem = inputItem;
        this.resultItem = resultItem;
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public String definitionKind() {
        return "enchantspecial";
    }

    public int inputItem() {
        return inputItem;
    }

    public int resultItem() {
        return resultItem;
    }
}
