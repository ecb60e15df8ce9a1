package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ServerShopTab {
    @JsonProperty("name")
    private String name;

    @JsonProperty("products")
    @JacksonXmlElementWrapper(localName = "products")
    private List<ServerShopProduct> products = new ArrayList<>();

    private ServerShopTab() {}

    public ServerShopTab(String name, List<ServerShopProduct> products) {
        this.name = name;
        this.products = new ArrayList<>(products);
    }

    public String name() {
        return name;
    }

    public List<ServerShopProduct> products() {
        return products == null ? List.of() : Collections.unmodifiableList(products);
    }
}
