package work.lcod.worlddata.model.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class EventOpenMenu extends Event {
    @JsonProperty("menuType")
    private int menuType;

    @JsonProperty("shopId")
    private int shopId;

    private EventOpenMenu() {}

    public EventOpenMenu(String id, int menuType, int shopId) {
        super(id);
        this.menuType = menuType;
        this.shopId = shopId;
    }

    @Override
    public EventType eventType() {
        return EventType.OPEN_MENU;
    }

    public int menuType() {
        return menuType;
    }

    public int shopId() {
        return shopId;
    }
}
