package com.timemarket.blockchain.contract;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Time Marketplace Smart Contract - Web3j wrapper.
 *
 * Solidity equivalent:
 * contract TimeMarketplaceFHE {
 *     struct Offer {
 *         uint256 id; address creator; string title; string description;
 *         uint256 publicPrice; uint256 duration; uint256 slots; uint256 availableSlots;
 *         bool isActive; uint256 createdAt; uint256 expiresAt;
 *         euint64 encryptedPrice; euint32 encryptedDuration; euint32 encryptedSlots;
 *     }
 *     struct Purchase { uint256 offerId; address buyer; uint256 slots; uint256 totalPrice; uint256 timestamp; }
 *
 *     mapping(uint256 => Offer) public offers;
 *     mapping(uint256 => Purchase) public purchases;
 *
 *     event OfferCreated(uint256 indexed offerId, address indexed creator, string title,
 *                        uint256 publicPrice, uint256 duration, uint256 slots);
 *     event OfferPurchased(uint256 indexed offerId, address indexed buyer, uint256 slots,
 *                          uint256 totalPrice, uint256 slotsLeft);
 *     event OfferDeactivated(uint256 indexed offerId, address indexed creator);
 *     event TallyRevealRequested(uint256 indexed offerId, bytes32 priceHandle, bytes32 slotsHandle);
 * }
 */
public class TimeMarketplaceContract extends Contract {

    /**
     * The contract is deployed separately; use {@link #load} with its address.
     */
    public static final String BINARY = "";

    public static final String FUNC_CREATEOFFER = "createOffer";
    public static final String FUNC_CREATEOFFERWITHFHE = "createOfferWithFHE";
    public static final String FUNC_PURCHASEOFFER = "purchaseOffer";
    public static final String FUNC_DEACTIVATEOFFER = "deactivateOffer";
    public static final String FUNC_REQUESTTALLYREVEAL = "requestTallyReveal";
    public static final String FUNC_RESOLVETALLYCALLBACK = "resolveTallyCallback";
    public static final String FUNC_UPDATEPLATFORMFEE = "updatePlatformFee";
    public static final String FUNC_UPDATETREASURY = "updateTreasury";
    public static final String FUNC_EMERGENCYWITHDRAW = "emergencyWithdraw";
    public static final String FUNC_OFFERS = "offers";
    public static final String FUNC_PURCHASES = "purchases";
    public static final String FUNC_GETACTIVEOFFERIDS = "getActiveOfferIds";
    public static final String FUNC_GETUSEROFFERS = "getUserOffers";
    public static final String FUNC_GETUSERPURCHASES = "getUserPurchases";
    public static final String FUNC_GETENCRYPTEDOFFERDATA = "getEncryptedOfferData";
    public static final String FUNC_GETCONTRACTSTATS = "getContractStats";
    public static final String FUNC_GETPLATFORMFEE = "getPlatformFee";
    public static final String FUNC_GETTREASURY = "getTreasury";
    public static final String FUNC_OWNER = "owner";

    // Events
    public static final Event OFFER_CREATED_EVENT = new Event("OfferCreated",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // offerId
                    new TypeReference<Address>(true) {},  // creator
                    new TypeReference<Utf8String>() {},   // title
                    new TypeReference<Uint256>() {},      // publicPrice
                    new TypeReference<Uint256>() {},      // duration
                    new TypeReference<Uint256>() {}       // slots
            ));

    public static final Event OFFER_PURCHASED_EVENT = new Event("OfferPurchased",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // offerId
                    new TypeReference<Address>(true) {},  // buyer
                    new TypeReference<Uint256>() {},      // slots
                    new TypeReference<Uint256>() {},      // totalPrice
                    new TypeReference<Uint256>() {}       // slotsLeft
            ));

    public static final Event OFFER_DEACTIVATED_EVENT = new Event("OfferDeactivated",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // offerId
                    new TypeReference<Address>(true) {}   // creator
            ));

    public static final Event TALLY_REVEAL_REQUESTED_EVENT = new Event("TallyRevealRequested",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // offerId
                    new TypeReference<Bytes32>() {},      // priceHandle
                    new TypeReference<Bytes32>() {}       // slotsHandle
            ));

    protected TimeMarketplaceContract(String contractAddress, Web3j web3j, Credentials credentials,
                                      ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    public RemoteFunctionCall<TransactionReceipt> createOffer(String title, String description,
                                                              BigInteger publicPrice, BigInteger duration,
                                                              BigInteger slots) {
        final Function function = new Function(
                FUNC_CREATEOFFER,
                Arrays.asList(new Utf8String(title), new Utf8String(description), new Uint256(publicPrice),
                        new Uint256(duration), new Uint256(slots)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    /**
     * Creates an offer whose price, duration and slots come from one encrypted
     * input bundle, authenticated by the shared {@code inputProof}.
     */
    public RemoteFunctionCall<TransactionReceipt> createOfferWithFHE(String title, String description,
                                                                     BigInteger publicPrice, BigInteger duration,
                                                                     BigInteger slots, byte[] encryptedPrice,
                                                                     byte[] encryptedDuration, byte[] encryptedSlots,
                                                                     byte[] inputProof) {
        final Function function = new Function(
                FUNC_CREATEOFFERWITHFHE,
                Arrays.asList(new Utf8String(title), new Utf8String(description), new Uint256(publicPrice),
                        new Uint256(duration), new Uint256(slots), new Bytes32(encryptedPrice),
                        new Bytes32(encryptedDuration), new Bytes32(encryptedSlots), new DynamicBytes(inputProof)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    /**
     * Buys slots; {@code weiValue} is the attached payment.
     */
    public RemoteFunctionCall<TransactionReceipt> purchaseOffer(BigInteger offerId, BigInteger slots,
                                                                BigInteger weiValue) {
        final Function function = new Function(
                FUNC_PURCHASEOFFER,
                Arrays.asList(new Uint256(offerId), new Uint256(slots)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function, weiValue);
    }

    public RemoteFunctionCall<TransactionReceipt> deactivateOffer(BigInteger offerId) {
        return executeRemoteCallTransaction(offerIdFunction(FUNC_DEACTIVATEOFFER, offerId));
    }

    public RemoteFunctionCall<TransactionReceipt> requestTallyReveal(BigInteger offerId) {
        return executeRemoteCallTransaction(offerIdFunction(FUNC_REQUESTTALLYREVEAL, offerId));
    }

    public RemoteFunctionCall<TransactionReceipt> resolveTallyCallback(BigInteger offerId, byte[] cleartexts,
                                                                       byte[] decryptionProof) {
        final Function function = new Function(
                FUNC_RESOLVETALLYCALLBACK,
                Arrays.asList(new Uint256(offerId), new DynamicBytes(cleartexts), new DynamicBytes(decryptionProof)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    public RemoteFunctionCall<TransactionReceipt> updatePlatformFee(BigInteger feeBps) {
        return executeRemoteCallTransaction(offerIdFunction(FUNC_UPDATEPLATFORMFEE, feeBps));
    }

    public RemoteFunctionCall<TransactionReceipt> updateTreasury(String treasury) {
        final Function function = new Function(
                FUNC_UPDATETREASURY,
                Arrays.asList(new Address(treasury)),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    public RemoteFunctionCall<TransactionReceipt> emergencyWithdraw() {
        final Function function = new Function(
                FUNC_EMERGENCYWITHDRAW,
                Collections.emptyList(),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    // ==================== Views ====================

    public RemoteFunctionCall<OfferData> offers(BigInteger offerId) {
        final Function function = new Function(
                FUNC_OFFERS,
                Arrays.asList(new Uint256(offerId)),
                Arrays.asList(
                        new TypeReference<Uint256>() {},     // id
                        new TypeReference<Address>() {},     // creator
                        new TypeReference<Utf8String>() {},  // title
                        new TypeReference<Utf8String>() {},  // description
                        new TypeReference<Uint256>() {},     // publicPrice
                        new TypeReference<Uint256>() {},     // duration
                        new TypeReference<Uint256>() {},     // slots
                        new TypeReference<Uint256>() {},     // availableSlots
                        new TypeReference<Bool>() {},        // isActive
                        new TypeReference<Uint256>() {},     // createdAt
                        new TypeReference<Uint256>() {},     // expiresAt
                        new TypeReference<Bytes32>() {},     // encryptedPrice
                        new TypeReference<Bytes32>() {},     // encryptedDuration
                        new TypeReference<Bytes32>() {}      // encryptedSlots
                ));
        return new RemoteFunctionCall<>(function, () -> OfferData.fromValues(executeCallMultipleValueReturn(function)));
    }

    public RemoteFunctionCall<PurchaseData> purchases(BigInteger purchaseId) {
        final Function function = new Function(
                FUNC_PURCHASES,
                Arrays.asList(new Uint256(purchaseId)),
                Arrays.asList(
                        new TypeReference<Uint256>() {},  // offerId
                        new TypeReference<Address>() {},  // buyer
                        new TypeReference<Uint256>() {},  // slots
                        new TypeReference<Uint256>() {},  // totalPrice
                        new TypeReference<Uint256>() {}   // timestamp
                ));
        return new RemoteFunctionCall<>(function,
                () -> PurchaseData.fromValues(executeCallMultipleValueReturn(function)));
    }

    public RemoteFunctionCall<List<BigInteger>> getActiveOfferIds() {
        return idListCall(new Function(
                FUNC_GETACTIVEOFFERIDS,
                Collections.emptyList(),
                Arrays.asList(new TypeReference<DynamicArray<Uint256>>() {})));
    }

    public RemoteFunctionCall<List<BigInteger>> getUserOffers(String user) {
        return idListCall(new Function(
                FUNC_GETUSEROFFERS,
                Arrays.asList(new Address(user)),
                Arrays.asList(new TypeReference<DynamicArray<Uint256>>() {})));
    }

    public RemoteFunctionCall<List<BigInteger>> getUserPurchases(String user) {
        return idListCall(new Function(
                FUNC_GETUSERPURCHASES,
                Arrays.asList(new Address(user)),
                Arrays.asList(new TypeReference<DynamicArray<Uint256>>() {})));
    }

    /**
     * Returns the price, duration and slots handles of an offer, in that order.
     */
    public RemoteFunctionCall<List<byte[]>> getEncryptedOfferData(BigInteger offerId) {
        final Function function = new Function(
                FUNC_GETENCRYPTEDOFFERDATA,
                Arrays.asList(new Uint256(offerId)),
                Arrays.asList(
                        new TypeReference<Bytes32>() {},
                        new TypeReference<Bytes32>() {},
                        new TypeReference<Bytes32>() {}));
        return new RemoteFunctionCall<>(function, () -> {
            List<byte[]> handles = new ArrayList<>(3);
            for (Type<?> value : executeCallMultipleValueReturn(function)) {
                handles.add(((Bytes32) value).getValue());
            }
            return handles;
        });
    }

    public RemoteFunctionCall<StatsData> getContractStats() {
        final Function function = new Function(
                FUNC_GETCONTRACTSTATS,
                Collections.emptyList(),
                Arrays.asList(
                        new TypeReference<Uint256>() {},  // totalOffersCreated
                        new TypeReference<Uint256>() {},  // totalPurchases
                        new TypeReference<Uint256>() {},  // totalVolume
                        new TypeReference<Uint256>() {}   // activeOffersCount
                ));
        return new RemoteFunctionCall<>(function, () -> {
            List<Type> values = executeCallMultipleValueReturn(function);
            return new StatsData(uint(values, 0), uint(values, 1), uint(values, 2), uint(values, 3));
        });
    }

    public RemoteFunctionCall<BigInteger> getPlatformFee() {
        final Function function = new Function(
                FUNC_GETPLATFORMFEE,
                Collections.emptyList(),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    public RemoteFunctionCall<String> getTreasury() {
        final Function function = new Function(
                FUNC_GETTREASURY,
                Collections.emptyList(),
                Arrays.asList(new TypeReference<Address>() {}));
        return executeRemoteCallSingleValueReturn(function, String.class);
    }

    public RemoteFunctionCall<String> owner() {
        final Function function = new Function(
                FUNC_OWNER,
                Collections.emptyList(),
                Arrays.asList(new TypeReference<Address>() {}));
        return executeRemoteCallSingleValueReturn(function, String.class);
    }

    /**
     * Loads an existing contract at the given address.
     */
    public static TimeMarketplaceContract load(String contractAddress, Web3j web3j,
                                               Credentials credentials, ContractGasProvider gasProvider) {
        return new TimeMarketplaceContract(contractAddress, web3j, credentials, gasProvider);
    }

    // ==================== Event decoding ====================

    public static String offerPurchasedTopic() {
        return EventEncoder.encode(OFFER_PURCHASED_EVENT);
    }

    /**
     * Decodes an {@code OfferPurchased} log, or returns null if the log is a
     * different event.
     */
    public static OfferPurchasedEventResponse decodeOfferPurchased(Log log) {
        EventValuesWithLog eventValues = staticExtractEventParametersWithLog(OFFER_PURCHASED_EVENT, log);
        if (eventValues == null) {
            return null;
        }
        OfferPurchasedEventResponse response = new OfferPurchasedEventResponse();
        response.log = log;
        response.offerId = (BigInteger) eventValues.getIndexedValues().get(0).getValue();
        response.buyer = (String) eventValues.getIndexedValues().get(1).getValue();
        response.slots = (BigInteger) eventValues.getNonIndexedValues().get(0).getValue();
        response.totalPrice = (BigInteger) eventValues.getNonIndexedValues().get(1).getValue();
        response.slotsLeft = (BigInteger) eventValues.getNonIndexedValues().get(2).getValue();
        return response;
    }

    public static TallyRevealRequestedEventResponse decodeTallyRevealRequested(Log log) {
        EventValuesWithLog eventValues = staticExtractEventParametersWithLog(TALLY_REVEAL_REQUESTED_EVENT, log);
        if (eventValues == null) {
            return null;
        }
        TallyRevealRequestedEventResponse response = new TallyRevealRequestedEventResponse();
        response.log = log;
        response.offerId = (BigInteger) eventValues.getIndexedValues().get(0).getValue();
        response.priceHandle = (byte[]) eventValues.getNonIndexedValues().get(0).getValue();
        response.slotsHandle = (byte[]) eventValues.getNonIndexedValues().get(1).getValue();
        return response;
    }

    // ==================== Private Helper Methods ====================

    private static Function offerIdFunction(String name, BigInteger value) {
        return new Function(name, Arrays.asList(new Uint256(value)), Collections.emptyList());
    }

    private RemoteFunctionCall<List<BigInteger>> idListCall(Function function) {
        return new RemoteFunctionCall<>(function, () -> {
            List<Type> values = executeCallMultipleValueReturn(function);
            return toIds(values.get(0));
        });
    }

    @SuppressWarnings("unchecked")
    private static List<BigInteger> toIds(Type<?> array) {
        List<Uint256> values = ((DynamicArray<Uint256>) array).getValue();
        List<BigInteger> ids = new ArrayList<>(values.size());
        for (Uint256 value : values) {
            ids.add(value.getValue());
        }
        return ids;
    }

    private static BigInteger uint(List<Type> values, int index) {
        return (BigInteger) values.get(index).getValue();
    }

    /**
     * Offer tuple returned by the {@code offers} getter.
     */
    public static class OfferData {
        public BigInteger id;
        public String creator;
        public String title;
        public String description;
        public BigInteger publicPrice;
        public BigInteger duration;
        public BigInteger slots;
        public BigInteger availableSlots;
        public boolean isActive;
        public BigInteger createdAt;
        public BigInteger expiresAt;
        public byte[] encryptedPrice;
        public byte[] encryptedDuration;
        public byte[] encryptedSlots;

        static OfferData fromValues(List<Type> values) {
            OfferData data = new OfferData();
            data.id = uint(values, 0);
            data.creator = (String) values.get(1).getValue();
            data.title = (String) values.get(2).getValue();
            data.description = (String) values.get(3).getValue();
            data.publicPrice = uint(values, 4);
            data.duration = uint(values, 5);
            data.slots = uint(values, 6);
            data.availableSlots = uint(values, 7);
            data.isActive = (Boolean) values.get(8).getValue();
            data.createdAt = uint(values, 9);
            data.expiresAt = uint(values, 10);
            data.encryptedPrice = (byte[]) values.get(11).getValue();
            data.encryptedDuration = (byte[]) values.get(12).getValue();
            data.encryptedSlots = (byte[]) values.get(13).getValue();
            return data;
        }
    }

    /**
     * Purchase tuple returned by the {@code purchases} getter.
     */
    public static class PurchaseData {
        public BigInteger offerId;
        public String buyer;
        public BigInteger slots;
        public BigInteger totalPrice;
        public BigInteger timestamp;

        static PurchaseData fromValues(List<Type> values) {
            PurchaseData data = new PurchaseData();
            data.offerId = uint(values, 0);
            data.buyer = (String) values.get(1).getValue();
            data.slots = uint(values, 2);
            data.totalPrice = uint(values, 3);
            data.timestamp = uint(values, 4);
            return data;
        }
    }

    public record StatsData(BigInteger totalOffersCreated, BigInteger totalPurchases,
                            BigInteger totalVolume, BigInteger activeOffersCount) {}

    public static class OfferPurchasedEventResponse {
        public Log log;
        public BigInteger offerId;
        public String buyer;
        public BigInteger slots;
        public BigInteger totalPrice;
        public BigInteger slotsLeft;
    }

    public static class TallyRevealRequestedEventResponse {
        public Log log;
        public BigInteger offerId;
        public byte[] priceHandle;
        public byte[] slotsHandle;
    }
}
