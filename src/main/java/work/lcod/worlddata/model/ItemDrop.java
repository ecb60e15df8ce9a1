package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class ItemDrop {
    @JsonProperty("itemType")
    private int itemType;

    @JsonProperty("minStack")
    private int minStack = 1;

    @JsonProperty("maxStack")
    private int maxStack = 1;

    @JsonProperty("rate")
    private float rate;

    private ItemDrop() {}

    public ItemDrop(int itemType, int minStack, int maxStack, float rate) {
        this.itemType = itemType;
        this.minStack = minStack;
        this.maxStack = maxStack;
        this.rate = rate;
    }

    public int itemType() {
        return itemType;
    }

    public int minStack() {
        return minStack;
    }

    public int maxStack() {
        return maxStack;
    }

    public float rate() {
        return rate;
    }
}
