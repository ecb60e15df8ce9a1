package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shop definition. COMP shops sell demon compendium entries and are indexed separately by the store.
 */
public final class ServerShop {
    /** Upper bound on tabs per shop; the client addresses tabs with a signed byte. */
    public static final int MAX_TABS = 100;

    public enum Type {
        DEFAULT,
        COMP_SHOP
    }

    @JsonProperty("shopId")
    private int shopId;

    @JsonProperty("type")
    private Type type = Type.DEFAULT;

    @JsonProperty("tabs")
    @JacksonXmlElementWrapper(localName = "tabs")
    private List<ServerShopTab> tabs = new ArrayList<>();

    private ServerShop() {}

    public ServerShop(int shopId, Type type, List<ServerShopTab> tabs) {
        this.shopId = shopId;
        this.type = type;
        this.tabs = new ArrayList<>(tabs);
    }

    public int shopId() {
        return shopId;
    }

    public Type type() {
        return type == null ? Type.DEFAULT : type;
    }

    public List<ServerShopTab> tabs() {
        return tabs == null ? List.of() : Collections.unmodifiableList(tabs);
    }
}
