package com.work.federation.web;

import com.work.federation.config.LedgerProperties;
import com.work.federation.domain.DomainRegistrationService;
import com.work.federation.domain.FederationDomain;
import com.work.federation.ledger.LedgerClient;
import com.work.federation.ledger.LedgerReceipt;
import com.work.federation.web.dto.RegisterDomainRequest;
import com.work.federation.web.dto.TxView;
import com.work.federation.web.dto.Web3InfoView;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 账本连接、交易回执与本域注册。
 */
@RestController
@RequestMapping("/api/v1/federation")
public class LedgerController {

    private final LedgerClient ledgerClient;
    private final LedgerProperties ledgerProperties;
    private final DomainRegistrationService registrationService;

    public LedgerController(LedgerClient ledgerClient,
                            LedgerProperties ledgerProperties,
                            DomainRegistrationService registrationService) {
        this.ledgerClient = ledgerClient;
        this.ledgerProperties = ledgerProperties;
        this.registrationService = registrationService;
    }

    @GetMapping("/web3-info")
    public Web3InfoView web3Info() {
        Web3InfoView v = new Web3InfoView();
        v.setMode(ledgerProperties.getMode());
        v.setRpcUrl(ledgerProperties.getRpcUrl());
        v.setConnector(ledgerClient.getConnector().describe());
        v.setDomainAddress(ledgerClient.getAddress());
        v.setContractAddress(ledgerProperties.getContractAddress());
        v.setLatestBlock(ledgerClient.latestBlockNumber());
        return v;
    }

    @GetMapping("/tx-receipt")
    public ResponseEntity<LedgerReceipt> receipt(@RequestParam("txHash") String txHash) {
        LedgerReceipt receipt = ledgerClient.getTransactionReceipt(txHash);
        if (receipt == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(receipt);
    }

    @GetMapping("/domain")
    public FederationDomain domain() {
        return registrationService.current();
    }

    @PostMapping("/domain")
    public TxView register(@Validated @RequestBody(required = false) RegisterDomainRequest req) {
        if (req == null || req.getName() == null || req.getName().trim().isEmpty()) {
            return TxView.from(registrationService.register());
        }
        return TxView.from(registrationService.register(req.getName().trim()));
    }

    @DeleteMapping("/domain")
    public TxView unregister() {
        return TxView.from(registrationService.unregister());
    }
}
