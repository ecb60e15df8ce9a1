package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Patch definition overlaid onto a zone, either automatically for the dynamic maps it lists or on request.
 *
 * <p>Partial 0 is the global partial: only its spawn data is meaningful, any NPCs, objects, spots or dynamic map
 * scope it carries are ignored.</p>
 */
public final class ServerZonePartial extends ZoneContent {
    public static final int GLOBAL_PARTIAL_ID = 0;

    @JsonProperty("id")
    private int id;

    @JsonProperty("autoApply")
    private boolean autoApply;

    private final Set<Integer> dynamicMapIds = new TreeSet<>();

    private ServerZonePartial() {}

    private ServerZonePartial(int id) {
        this.id = id;
    }

    public static Builder builder(int id) {
        return new Builder(new ServerZonePartial(id));
    }

    public int id() {
        return id;
    }

    public boolean isGlobal() {
        return id == GLOBAL_PARTIAL_ID;
    }

    public boolean autoApply() {
        return autoApply;
    }

    /**
     * Dynamic maps this partial is scoped to; empty means every dynamic map.
     */
    public Set<Integer> dynamicMapIds() {
        return Collections.unmodifiableSet(dynamicMapIds);
    }

    public boolean appliesTo(int dynamicMapId) {
        return dynamicMapIds.isEmpty() || dynamicMapIds.contains(dynamicMapId);
    }

    @JsonProperty("dynamicMapIds")
    @JacksonXmlElementWrapper(localName = "dynamicMapIds")
    private void setDynamicMapIds(List<Integer> values) {
        dynamicMapIds.clear();
        if (values != null) {
            dynamicMapIds.addAll(values);
        }
    }

    @Override
    public String toString() {
        return "ServerZonePartial[" + id + (autoApply ? ", auto " + dynamicMapIds : "") + "]";
    }

    public static final class Builder extends ZoneContent.Builder<ServerZonePartial, Builder> {
        private Builder(ServerZonePartial target) {
            super(target);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder autoApply(boolean autoApply) {
            target.autoApply = autoApply;
            return this;
        }

        public Builder dynamicMapId(int dynamicMapId) {
            target.dynamicMapIds.add(dynamicMapId);
            return this;
        }
    }
}
