package io.relaypay.merchant.ledger;

import io.relaypay.merchant.config.LedgerProperties;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

/** JSON-RPC ledger client. The only place that knows contract ABIs and tuple positions. */
@Component
public class Web3jLedgerClient implements LedgerClient {

  private static final Logger log = LoggerFactory.getLogger(Web3jLedgerClient.class);

  static final Event PAYMENT_COMPLETED =
      new Event(
          "PaymentCompleted",
          List.<TypeReference<?>>of(
              new TypeReference<Bytes32>(true) {},
              new TypeReference<Address>(true) {},
              new TypeReference<Uint256>() {},
              new TypeReference<Uint256>() {},
              new TypeReference<Uint256>() {}));

  private final Web3j web3j;
  private final LedgerProperties properties;

  public Web3jLedgerClient(Web3j web3j, LedgerProperties properties) {
    this.web3j = web3j;
    this.properties = properties;
  }

  @Override
  public long getBlockNumber() {
    EthBlockNumber response = send("eth_blockNumber", () -> web3j.ethBlockNumber().send());
    return response.getBlockNumber().longValueExact();
  }

  @Override
  public Optional<ReceiptInfo> getTransactionReceipt(String transactionHash) {
    EthGetTransactionReceipt response =
        send(
            "eth_getTransactionReceipt",
            () -> web3j.ethGetTransactionReceipt(transactionHash).send());
    return response
        .getTransactionReceipt()
        .map(
            receipt ->
                new ReceiptInfo(
                    receipt.getTransactionHash(),
                    receipt.getBlockNumber().longValueExact(),
                    isSuccessful(receipt),
                    receipt.getTo()));
  }

  @Override
  public ListenerRecord getListener(String listenerAddress) {
    var function =
        new Function(
            "getListener",
            List.<Type>of(new Address(listenerAddress)),
            List.<TypeReference<?>>of(
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Bool>() {},
                new TypeReference<Bool>() {},
                new TypeReference<Uint256>() {}));

    List<Type> values = call(properties.listenerRegistryAddress(), function);
    return new ListenerRecord(
        ((Address) values.get(0)).getValue(),
        uint(values.get(1)),
        uint(values.get(2)),
        uint(values.get(3)),
        uint(values.get(4)),
        uint(values.get(5)),
        uint(values.get(6)),
        uint(values.get(7)),
        ((Bool) values.get(8)).getValue(),
        ((Bool) values.get(9)).getValue(),
        uint(values.get(10)));
  }

  @Override
  public PaymentRecord getPayment(String paymentId) {
    var function =
        new Function(
            "getPayment",
            List.<Type>of(new Bytes32(Numeric.hexStringToByteArray(paymentId))),
            List.<TypeReference<?>>of(
                new TypeReference<Bytes32>() {},
                new TypeReference<Address>() {},
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint8>() {},
                new TypeReference<Uint8>() {},
                new TypeReference<Bytes32>() {},
                new TypeReference<Uint256>() {}));

    List<Type> values = call(properties.paymentDatabaseAddress(), function);
    return new PaymentRecord(
        Numeric.toHexString(((Bytes32) values.get(0)).getValue()),
        ((Address) values.get(1)).getValue(),
        ((Address) values.get(2)).getValue(),
        uint(values.get(3)),
        uint(values.get(4)),
        uint(values.get(5)).intValueExact(),
        OnChainPaymentStatus.fromCode(uint(values.get(6)).intValueExact()),
        Numeric.toHexString(((Bytes32) values.get(7)).getValue()),
        uint(values.get(8)));
  }

  @Override
  public List<PaymentCompletedEvent> findPaymentCompletedEvents(
      String paymentId, String merchant, long fromBlock, long toBlock) {
    var filter =
        new EthFilter(
            DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
            DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)),
            properties.paymentRouterAddress());
    filter.addSingleTopic(EventEncoder.encode(PAYMENT_COMPLETED));
    filter.addSingleTopic(Numeric.toHexStringWithPrefixZeroPadded(Numeric.toBigInt(paymentId), 64));
    filter.addSingleTopic("0x" + TypeEncoder.encode(new Address(merchant)));

    EthLog response = send("eth_getLogs", () -> web3j.ethGetLogs(filter).send());

    var events = new ArrayList<PaymentCompletedEvent>();
    for (EthLog.LogResult<?> result : response.getLogs()) {
      if (!(result instanceof EthLog.LogObject logObject)) {
        continue;
      }
      events.add(decodePaymentCompleted(logObject.get()));
    }
    return events;
  }

  private PaymentCompletedEvent decodePaymentCompleted(Log entry) {
    List<String> topics = entry.getTopics();
    if (topics.size() < 3) {
      throw new LedgerException("PaymentCompleted log without indexed topics");
    }
    List<Type> data =
        FunctionReturnDecoder.decode(entry.getData(), PAYMENT_COMPLETED.getNonIndexedParameters());
    String merchantTopic = topics.get(2);
    return new PaymentCompletedEvent(
        topics.get(1),
        "0x" + merchantTopic.substring(merchantTopic.length() - 40),
        uint(data.get(0)),
        uint(data.get(1)),
        uint(data.get(2)),
        entry.getBlockNumber().longValueExact(),
        entry.getTransactionHash());
  }

  private List<Type> call(String contractAddress, Function function) {
    String encoded = FunctionEncoder.encode(function);
    EthCall response =
        send(
            "eth_call " + function.getName(),
            () ->
                web3j
                    .ethCall(
                        Transaction.createEthCallTransaction(null, contractAddress, encoded),
                        DefaultBlockParameterName.LATEST)
                    .send());
    if (response.isReverted()) {
      throw new LedgerException(
          function.getName() + " reverted: " + response.getRevertReason());
    }
    List<Type> values =
        FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
    if (values.size() != function.getOutputParameters().size()) {
      throw new LedgerException(
          function.getName() + " returned no data from " + contractAddress);
    }
    return values;
  }

  private <R extends Response<?>> R send(String operation, RpcCall<R> rpcCall) {
    R response;
    try {
      response = rpcCall.execute();
    } catch (IOException e) {
      log.debug("Ledger RPC {} failed: {}", operation, e.toString());
      throw new LedgerException(operation + " failed: " + LedgerFailures.describe(e), e);
    }
    if (response.hasError()) {
      throw new LedgerException(operation + " error: " + response.getError().getMessage());
    }
    return response;
  }

  private static BigInteger uint(Type value) {
    return (BigInteger) value.getValue();
  }

  private static boolean isSuccessful(TransactionReceipt receipt) {
    // Pre-byzantium receipts carry no status field.
    return receipt.getStatus() == null || receipt.isStatusOK();
  }

  @FunctionalInterface
  private interface RpcCall<R> {
    R execute() throws IOException;
  }
}
