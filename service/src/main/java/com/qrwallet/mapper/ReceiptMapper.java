package com.qrwallet.mapper;

import com.qrwallet.api.response.TransactionReceiptResponse;
import com.qrwallet.model.TransactionReceipt;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface ReceiptMapper {
    ReceiptMapper INSTANCE = Mappers.getMapper(ReceiptMapper.class);

    TransactionReceiptResponse toResponse(TransactionReceipt receipt);

    List<TransactionReceiptResponse> toResponses(List<TransactionReceipt> receipts);
}
