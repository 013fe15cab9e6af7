package com.example.affairsdigest.service.extract;

import com.example.affairsdigest.exception.FetchException;
import org.jsoup.nodes.Document;

public interface PageFetcher {
    Document fetch(String url) throws FetchException;
}
