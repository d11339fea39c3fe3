package io.syncbeat.odoo.model;

import io.syncbeat.mirror.MirroredRecord;

import java.time.Instant;

/**
 * Local mirror of an Odoo {@code res.partner}.
 */
public class Contact extends MirroredRecord {

    private String name;
    private String email;
    private String phone;
    private Instant writeDate;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public Instant getWriteDate() {
        return writeDate;
    }

    public void setWriteDate(Instant writeDate) {
        this.writeDate = writeDate;
    }

    @Override
    public String toString() {
        return "Contact{remoteId=" + getRemoteId() + ", name=" + name + ", email=" + email + "}";
    }
}
