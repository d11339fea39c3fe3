package io.syncbeat.odoo.model;

import io.syncbeat.mirror.MirroredRecord;

import java.time.Instant;

/**
 * Local mirror of an Odoo customer invoice ({@code account.move} with move type {@code out_invoice}).
 * Partner and currency are kept as the remote id plus display name.
 */
public class Invoice extends MirroredRecord {

    public static final String CUSTOMER_INVOICE = "out_invoice";

    private String name;
    private String moveType;
    private Instant invoiceDate;
    private Long partnerId;
    private String partnerName;
    private Double amountTotal;
    private Double amountResidual;
    private String state;
    private Long currencyId;
    private String currencyName;
    private Instant writeDate;
    private Instant createDate;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getMoveType() {
        return moveType;
    }

    public void setMoveType(String moveType) {
        this.moveType = moveType;
    }

    public Instant getInvoiceDate() {
        return invoiceDate;
    }

    public void setInvoiceDate(Instant invoiceDate) {
        this.invoiceDate = invoiceDate;
    }

    public Long getPartnerId() {
        return partnerId;
    }

    public void setPartnerId(Long partnerId) {
        this.partnerId = partnerId;
    }

    public String getPartnerName() {
        return partnerName;
    }

    public void setPartnerName(String partnerName) {
        this.partnerName = partnerName;
    }

    public Double getAmountTotal() {
        return amountTotal;
    }

    public void setAmountTotal(Double amountTotal) {
        this.amountTotal = amountTotal;
    }

    public Double getAmountResidual() {
        return amountResidual;
    }

    public void setAmountResidual(Double amountResidual) {
        this.amountResidual = amountResidual;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public Long getCurrencyId() {
        return currencyId;
    }

    public void setCurrencyId(Long currencyId) {
        this.currencyId = currencyId;
    }

    public String getCurrencyName() {
        return currencyName;
    }

    public void setCurrencyName(String currencyName) {
        this.currencyName = currencyName;
    }

    public Instant getWriteDate() {
        return writeDate;
    }

    public void setWriteDate(Instant writeDate) {
        this.writeDate = writeDate;
    }

    public Instant getCreateDate() {
        return createDate;
    }

    public void setCreateDate(Instant createDate) {
        this.createDate = createDate;
    }

    @Override
    public String toString() {
        return "Invoice{remoteId=" + getRemoteId() + ", name=" + name + ", amountTotal=" + amountTotal
                + ", state=" + state + "}";
    }
}
