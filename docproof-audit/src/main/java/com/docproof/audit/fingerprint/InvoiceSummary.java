package com.docproof.audit.fingerprint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Content-free summary of a parsed invoice, safe to retain. VAT ids are masked to their first and
 * last two characters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class InvoiceSummary {

    public static final String UNKNOWN_FORMAT = "unknown";
    public static final InvoiceSummary EMPTY = new InvoiceSummary(null, null, null, null, null, null, null, null);

    private final String format;
    private final String invoiceNumber;
    private final String issueDate;
    private final String currency;
    private final BigDecimal totalAmount;
    private final String sellerVatId;
    private final String buyerVatId;
    private final Integer lineItemCount;

    @JsonCreator
    public InvoiceSummary(
            @JsonProperty("format") String format,
            @JsonProperty("invoiceNumber") String invoiceNumber,
            @JsonProperty("issueDate") String issueDate,
            @JsonProperty("currency") String currency,
            @JsonProperty("totalAmount") BigDecimal totalAmount,
            @JsonProperty("sellerVatId") String sellerVatId,
            @JsonProperty("buyerVatId") String buyerVatId,
            @JsonProperty("lineItemCount") Integer lineItemCount) {
        this.format = format != null ? format : UNKNOWN_FORMAT;
        this.invoiceNumber = invoiceNumber;
        this.issueDate = issueDate;
        this.currency = currency;
        this.totalAmount = totalAmount;
        this.sellerVatId = sellerVatId;
        this.buyerVatId = buyerVatId;
        this.lineItemCount = lineItemCount;
    }

    /**
     * Summary of a parsed document map as produced by a parsing filter. Reads {@code format},
     * {@code invoiceNumber}, {@code issueDate}, {@code currency}, {@code totalAmount},
     * {@code seller.vatId}, {@code buyer.vatId} and {@code lineItems}.
     *
     * @param parsed parsed document, or null when nothing was parsed
     */
    public static InvoiceSummary from(Object parsed) {
        if (!(parsed instanceof Map<?, ?> doc)) {
            return EMPTY;
        }
        Object lineItems = doc.get("lineItems");
        return new InvoiceSummary(
                text(doc.get("format")),
                text(doc.get("invoiceNumber")),
                text(doc.get("issueDate")),
                text(doc.get("currency")),
                amount(doc.get("totalAmount")),
                maskVatId(text(nested(doc, "seller", "vatId"))),
                maskVatId(text(nested(doc, "buyer", "vatId"))),
                lineItems instanceof Collection<?> c ? c.size() : null);
    }

    /** {@code DE123456789} → {@code DE***89}; ids of four characters or fewer become {@code ****}. */
    public static String maskVatId(String vatId) {
        if (vatId == null || vatId.isEmpty()) return null;
        if (vatId.length() <= 4) return "****";
        return vatId.substring(0, 2) + "***" + vatId.substring(vatId.length() - 2);
    }

    private static Object nested(Map<?, ?> doc, String parent, String key) {
        Object p = doc.get(parent);
        return p instanceof Map<?, ?> m ? m.get(key) : null;
    }

    private static String text(Object v) {
        return v != null ? String.valueOf(v) : null;
    }

    private static BigDecimal amount(Object v) {
        if (v == null) return null;
        if (v instanceof BigDecimal d) return d;
        try {
            return new BigDecimal(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String getFormat() {
        return format;
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    public String getIssueDate() {
        return issueDate;
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public String getSellerVatId() {
        return sellerVatId;
    }

    public String getBuyerVatId() {
        return buyerVatId;
    }

    public Integer getLineItemCount() {
        return lineItemCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InvoiceSummary that = (InvoiceSummary) o;
        return format.equals(that.format) && Objects.equals(invoiceNumber, that.invoiceNumber)
                && Objects.equals(issueDate, that.issueDate) && Objects.equals(currency, that.currency)
                && Objects.equals(totalAmount, that.totalAmount) && Objects.equals(sellerVatId, that.sellerVatId)
                && Objects.equals(buyerVatId, that.buyerVatId) && Objects.equals(lineItemCount, that.lineItemCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, invoiceNumber, issueDate, currency, totalAmount, sellerVatId, buyerVatId,
                lineItemCount);
    }

    @Override
    public String toString() {
        return "InvoiceSummary{format=" + format + ", lineItems=" + lineItemCount + "}";
    }
}
