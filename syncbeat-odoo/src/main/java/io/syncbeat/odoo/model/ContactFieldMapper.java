package io.syncbeat.odoo.model;

import io.syncbeat.mirror.FieldMapper;

import java.util.Map;

import static io.syncbeat.mirror.RemoteValues.text;
import static io.syncbeat.mirror.RemoteValues.textOr;
import static io.syncbeat.mirror.RemoteValues.timestamp;

public class ContactFieldMapper implements FieldMapper<Contact> {

    @Override
    public Contact create() {
        return new Contact();
    }

    @Override
    public void apply(Map<String, Object> remote, Contact target) {
        target.setName(textOr(remote.get("name"), ""));
        target.setEmail(text(remote.get("email")));
        target.setPhone(text(remote.get("phone")));
        target.setWriteDate(timestamp(remote.get("write_date")));
    }
}
