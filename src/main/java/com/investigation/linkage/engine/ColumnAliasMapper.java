package com.investigation.linkage.engine;

import com.investigation.linkage.model.ColumnMapping;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps raw CSV headers from banks, registries and forensic extraction tools
 * (Cellebrite, UFED, XRY, Chainalysis exports, Thai-language statements) onto canonical field names.
 *
 * Matching, strongest first:
 *   1. header is a canonical name                     -> confidence 100
 *   2. header equals or contains a known alias        -> confidence 90
 *   3. header contains, or is contained in, a canonical name -> confidence 70
 *   4. no match: header kept as-is                    -> confidence 0
 */
@Component
public class ColumnAliasMapper {

    private static final Map<String, List<String>> ALIASES = new LinkedHashMap<>();

    static {
        // Person registry
        ALIASES.put("first_name", List.of("firstname", "fname", "given_name", "ชื่อ", "ชื่อจริง"));
        ALIASES.put("last_name", List.of("lastname", "lname", "surname", "family_name", "นามสกุล"));
        ALIASES.put("prefix", List.of("คำนำหน้า", "title", "salutation"));
        ALIASES.put("id_card", List.of("idcard", "id_number", "citizen_id", "national_id", "thai_id",
                "เลขบัตรประชาชน", "รหัสประชาชน"));
        ALIASES.put("phone", List.of("phone_number", "mobile", "telephone", "contact_phone",
                "เบอร์โทร", "หมายเลขโทรศัพท์"));
        ALIASES.put("email", List.of("email_address", "e-mail", "อีเมล"));
        ALIASES.put("bank_account", List.of("account_number", "account_no", "acc_no", "bank_acc", "เลขบัญชี"));
        ALIASES.put("wallet_address", List.of("crypto_address", "btc_address", "eth_address", "address_crypto"));
        ALIASES.put("role", List.of("person_type", "classification", "บทบาท"));
        ALIASES.put("occupation", List.of("job", "อาชีพ"));
        ALIASES.put("address", List.of("ที่อยู่", "home_address"));

        // Bank transactions
        ALIASES.put("from_account", List.of("source_account", "sender_account", "debit_account", "from_acc",
                "บัญชีต้นทาง", "บัญชีผู้โอน"));
        ALIASES.put("to_account", List.of("target_account", "receiver_account", "credit_account", "to_acc",
                "dest_account", "บัญชีปลายทาง", "บัญชีผู้รับ"));
        ALIASES.put("from_name", List.of("sender_name", "source_name", "payer_name", "caller_name", "ชื่อผู้โอน"));
        ALIASES.put("to_name", List.of("receiver_name", "target_name", "payee_name", "beneficiary_name", "called_name",
                "ชื่อผู้รับ"));
        ALIASES.put("amount", List.of("transaction_amount", "transfer_amount", "จำนวนเงิน", "ยอดเงิน"));
        ALIASES.put("bank", List.of("ธนาคาร", "bank_name"));
        ALIASES.put("to_bank", List.of("receiver_bank", "dest_bank"));

        // Phone records
        ALIASES.put("from_number", List.of("caller", "calling_number", "source_number", "originating_number",
                "a_number", "msisdn_a", "เบอร์ต้นทาง", "เบอร์โทรออก"));
        ALIASES.put("to_number", List.of("called_number", "target_number", "destination_number",
                "b_number", "msisdn_b", "เบอร์ปลายทาง", "เบอร์รับสาย"));
        ALIASES.put("duration_sec", List.of("call_duration", "duration_seconds", "duration", "ระยะเวลา"));
        ALIASES.put("call_type", List.of("call_direction", "direction", "ประเภทการโทร"));
        ALIASES.put("cell_tower", List.of("cell_id", "tower_id", "เสาสัญญาณ"));
        ALIASES.put("location", List.of("สถานที่"));

        // Crypto transfers
        ALIASES.put("from_wallet", List.of("source_wallet", "sender_wallet", "from_address", "source_address"));
        ALIASES.put("to_wallet", List.of("target_wallet", "receiver_wallet", "to_address", "dest_address",
                "destination_wallet", "destination_address"));
        ALIASES.put("from_label", List.of("source_label", "sender_label"));
        ALIASES.put("to_label", List.of("target_label", "receiver_label"));
        ALIASES.put("tx_hash", List.of("transaction_hash", "txid", "hash", "transaction_id"));
        ALIASES.put("currency", List.of("coin", "token", "asset"));
        ALIASES.put("amount_thb", List.of("thb_amount", "value_thb"));
        ALIASES.put("amount_usd", List.of("usd_amount", "value_usd"));
        ALIASES.put("exchange", List.of("exchange_name"));

        // Common
        ALIASES.put("date", List.of("transaction_date", "trx_date", "datetime", "timestamp", "วันที่"));
        ALIASES.put("time", List.of("transaction_time", "trx_time", "เวลา"));
        ALIASES.put("note", List.of("notes", "remark", "remarks", "memo", "หมายเหตุ"));
        ALIASES.put("ref", List.of("reference", "ref_no", "reference_number", "transaction_ref", "เลขอ้างอิง"));
    }

    public List<ColumnMapping> map(List<String> headers) {
        List<ColumnMapping> mappings = new ArrayList<>(headers.size());
        for (String header : headers) {
            mappings.add(mapHeader(header));
        }
        return mappings;
    }

    public ColumnMapping mapHeader(String header) {
        String original = header == null ? "" : header;
        String col = original.trim().toLowerCase(Locale.ROOT);

        if (ALIASES.containsKey(col)) {
            return mapping(original, col, 100, true);
        }

        if (!col.isEmpty()) {
            // Exact aliases first: "ชื่อผู้โอน" must not fall into first_name via "ชื่อ"
            for (Map.Entry<String, List<String>> entry : ALIASES.entrySet()) {
                if (entry.getValue().contains(col)) {
                    return mapping(original, entry.getKey(), 90, true);
                }
            }
            for (Map.Entry<String, List<String>> entry : ALIASES.entrySet()) {
                for (String alias : entry.getValue()) {
                    if (col.contains(alias)) {
                        return mapping(original, entry.getKey(), 90, true);
                    }
                }
            }

            for (String canonical : ALIASES.keySet()) {
                if (col.contains(canonical) || canonical.contains(col)) {
                    return mapping(original, canonical, 70, true);
                }
            }
        }

        return mapping(original, col, 0, false);
    }

    private ColumnMapping mapping(String original, String mapped, int confidence, boolean autoMapped) {
        return ColumnMapping.builder()
                .original(original)
                .mapped(mapped)
                .confidence(confidence)
                .autoMapped(autoMapped)
                .build();
    }
}
