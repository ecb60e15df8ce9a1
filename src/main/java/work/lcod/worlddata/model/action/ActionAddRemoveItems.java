package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Adds items to (positive quantity) or removes items from (negative quantity) the source's inventory.
 */
public final class ActionAddRemoveItems extends Action {
    @JsonProperty("itemType")
    private int itemType;

    @JsonProperty("quantity")
    private int quantity;

    @JsonProperty("notify")
    private boolean notify;

    private ActionAddRemoveItems() {}

    public ActionAddRemoveItems(SourceContext sourceContext, int itemType, int quantity) {
        super(sourceContext);
        this.itemType = itemType;
        this.quantity = quantity;
    }

    @Override
    public ActionType actionType() {
        return ActionType.ADD_REMOVE_ITEMS;
    }

    public int itemType() {
        return itemType;
    }

    public int quantity() {
        return quantity;
    }

    public boolean notifyPlayer() {
        return notify;
    }
}
