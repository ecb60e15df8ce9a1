package work.lcod.worlddata.model.instance;

public enum PvPMatchType {
    FATE,
    VALHALLA,
    CUSTOM
}
