package com.prophit.insights.synthetic;

import com.prophit.insights.model.Transaction;
import com.prophit.insights.model.TransactionSummary;
import java.util.List;

public record SyntheticDataset(int id, Persona persona, List<Transaction> transactions, TransactionSummary summary) {
}
