package com.vybescope.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vybescope.domain.EventDirection;
import com.vybescope.domain.TokenHolder;
import com.vybescope.domain.TokenStats;
import com.vybescope.domain.TransactionEvent;
import com.vybescope.domain.WalletSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps Vybe JSON bodies to domain records. Unparseable numeric fields degrade to null (or zero for
 * transfer values) instead of failing the whole page.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VybeResponseParser {

    private final ObjectMapper objectMapper;

    /**
     * One /token/transfers page.
     *
     * @param entries raw entry count as returned by the provider, skipped entries included
     */
    public record TransferPage(List<TransactionEvent> events, int entries) {
    }

    /**
     * Parses a /token/transfers page. Entries without a signature or block time are skipped.
     *
     * @param subject   wallet address or token mint the page was requested for
     * @param direction direction the subject sees for every entry of this page
     */
    public TransferPage parseTransfers(String json, String subject, EventDirection direction) {
        JsonNode transfers = readTree(json).path("transfers");
        if (!transfers.isArray()) {
            return new TransferPage(List.of(), 0);
        }
        List<TransactionEvent> events = new ArrayList<>(transfers.size());
        for (JsonNode tx : transfers) {
            String signature = text(tx, "signature");
            long blockTime = tx.path("blockTime").asLong(0L);
            if (signature == null || blockTime <= 0) {
                log.debug("Skipping transfer without signature/blockTime for {}", subject);
                continue;
            }
            String mint = text(tx, "mintAddress");
            BigDecimal valueUsd = decimal(tx, "valueUsd");
            events.add(new TransactionEvent(
                    TransactionEvent.deriveEventId(signature, mint, direction, subject),
                    subject,
                    signature,
                    mint,
                    symbolOf(tx, mint),
                    valueUsd != null ? valueUsd : BigDecimal.ZERO,
                    decimal(tx, "calculatedAmount"),
                    Instant.ofEpochSecond(blockTime),
                    direction,
                    text(tx, "senderAddress"),
                    text(tx, "receiverAddress")));
        }
        return new TransferPage(events, transfers.size());
    }

    public TokenStats parseTokenStats(String json, String mintAddress) {
        JsonNode root = readTree(json);
        String mint = text(root, "mintAddress");
        return new TokenStats(
                mint != null ? mint : mintAddress,
                text(root, "symbol"),
                text(root, "name"),
                decimal(root, "price"),
                decimal(root, "price1d"),
                decimal(root, "price7d"),
                decimal(root, "marketCap"),
                decimal(root, "currentSupply"),
                decimal(root, "usdValueVolume24h"),
                root.path("verified").asBoolean(false),
                text(root, "logoUrl"));
    }

    public WalletSnapshot parseWalletSnapshot(String json, String ownerAddress) {
        JsonNode root = readTree(json);
        List<WalletSnapshot.TokenBalance> tokens = new ArrayList<>();
        JsonNode data = root.path("data");
        if (data.isArray()) {
            for (JsonNode t : data) {
                tokens.add(new WalletSnapshot.TokenBalance(
                        text(t, "mintAddress"),
                        text(t, "symbol"),
                        text(t, "name"),
                        decimal(t, "amount"),
                        decimal(t, "valueUsd"),
                        decimal(t, "priceUsd"),
                        decimal(t, "priceUsd1dChange")));
            }
        }
        BigDecimal total = decimal(root, "totalTokenValueUsd");
        BigDecimal change = decimal(root, "totalTokenValueUsd1dChange");
        return new WalletSnapshot(
                ownerAddress,
                total != null ? total : BigDecimal.ZERO,
                change != null ? change : BigDecimal.ZERO,
                root.path("totalTokenCount").asInt(tokens.size()),
                List.copyOf(tokens));
    }

    public List<TokenHolder> parseTopHolders(String json, int count) {
        JsonNode data = readTree(json).path("data");
        if (!data.isArray()) {
            return List.of();
        }
        List<TokenHolder> holders = new ArrayList<>();
        int position = 0;
        for (JsonNode h : data) {
            if (holders.size() >= count) {
                break;
            }
            position++;
            holders.add(new TokenHolder(
                    h.path("rank").asInt(position),
                    text(h, "ownerAddress"),
                    text(h, "ownerName"),
                    decimal(h, "balance"),
                    decimal(h, "valueUsd"),
                    decimal(h, "percentageOfSupplyHeld")));
        }
        return holders;
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new VybeApiException(0, "Malformed Vybe response: " + e.getOriginalMessage(), e);
        }
    }

    private static String symbolOf(JsonNode tx, String mint) {
        String symbol = text(tx, "symbol");
        if (symbol == null) {
            symbol = text(tx, "tokenSymbol");
        }
        return symbol != null ? symbol : mint;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String s = value.asText();
        return s.isBlank() ? null : s;
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        String s = value.asText();
        if (s.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            log.debug("Could not parse {} '{}' as a number", field, s);
            return null;
        }
    }
}
