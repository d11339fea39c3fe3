package io.syncbeat.mirror;

import java.util.HashMap;
import java.util.Map;

public class Widget extends MirroredRecord {

    private String name;
    private Double price;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Double getPrice() {
        return price;
    }

    public void setPrice(Double price) {
        this.price = price;
    }

    public static final FieldMapper<Widget> MAPPER = new FieldMapper<>() {
        @Override
        public Widget create() {
            return new Widget();
        }

        @Override
        public void apply(Map<String, Object> remote, Widget target) {
            target.setName(RemoteValues.textOr(remote.get("name"), ""));
            target.setPrice(RemoteValues.number(remote.get("price")));
        }
    };

    public static Map<String, Object> remote(Object id, String name) {
        Map<String, Object> record = new HashMap<>();
        record.put("id", id);
        record.put("name", name);
        record.put("price", false);
        return record;
    }
}
