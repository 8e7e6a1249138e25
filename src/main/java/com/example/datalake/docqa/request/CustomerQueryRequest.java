package com.example.datalake.docqa.request;

public record CustomerQueryRequest(String question, String customerName, String customerEmail) {
}
